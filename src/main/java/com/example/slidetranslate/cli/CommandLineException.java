package com.example.slidetranslate.cli;

/**
 * Invalid command line usage.
 */
public class CommandLineException extends RuntimeException {

    public CommandLineException(String message) {
        super(message);
    }
}
