package com.example.slidetranslate;

import com.example.slidetranslate.cli.CommandLineException;
import com.example.slidetranslate.cli.CommandLineOptions;
import com.example.slidetranslate.service.PresentationTranslationService;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
public class SlideTranslateApplication {

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Runs one translation and returns the process exit code. Every failure ends up
     * as a single diagnostic line on {@code out}.
     */
    static int run(String[] args, PrintStream out) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (CommandLineException e) {
            out.println("Error: " + e.getMessage());
            return 1;
        }

        if (!Files.isRegularFile(options.getInputFile())) {
            out.println("Error: Input file '" + options.getInputFile() + "' not found.");
            return 1;
        }
        if (!Files.isRegularFile(options.getConfigFile())) {
            out.println("Error: Config file not found: " + options.getConfigFile());
            return 1;
        }

        SpringApplication application = new SpringApplication(SlideTranslateApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        application.setBannerMode(Banner.Mode.OFF);

        try (ConfigurableApplicationContext context = application.run(options.toSpringArguments())) {
            Path output = context.getBean(PresentationTranslationService.class)
                .translate(options.getInputFile(), options.resolveOutputFile());
            out.println("Done! Saved translated file to '" + output + "'.");
            return 0;
        } catch (Exception e) {
            out.println("An error occurred: " + describe(e));
            return 1;
        }
    }

    private static String describe(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        return message.replace('\n', ' ').replace('\r', ' ');
    }
}
