package com.example.slidetranslate.service.ai;

import com.example.slidetranslate.dto.translation.BatchItem;
import com.example.slidetranslate.dto.translation.BatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented batch wire format. Requests are {@code <id> ::: <limit> ::: <markup>}
 * lines, responses {@code <id> ::: <translation>} lines.
 */
public final class BatchProtocol {

    private static final Logger logger = LoggerFactory.getLogger(BatchProtocol.class);

    public static final String DELIMITER = ":::";

    private BatchProtocol() {
    }

    public static String serialize(List<BatchItem> items) {
        StringBuilder payload = new StringBuilder();
        for (BatchItem item : items) {
            if (payload.length() > 0) {
                payload.append('\n');
            }
            payload.append(item.getId())
                .append(' ').append(DELIMITER).append(' ')
                .append(item.getLimit())
                .append(' ').append(DELIMITER).append(' ')
                .append(item.getText());
        }
        return payload.toString();
    }

    /**
     * Parse a response. Lines without the delimiter or with a non-numeric id are
     * skipped; nothing here throws.
     */
    public static List<BatchResult> parse(String response) {
        List<BatchResult> results = new ArrayList<>();
        if (response == null) {
            return results;
        }

        for (String line : response.split("\\R")) {
            int delimiter = line.indexOf(DELIMITER);
            if (delimiter < 0) {
                continue;
            }
            String idPart = line.substring(0, delimiter).trim();
            int id;
            try {
                id = Integer.parseInt(idPart);
            } catch (NumberFormatException e) {
                logger.debug("Ignoring response line with id '{}'", idPart);
                continue;
            }
            results.add(new BatchResult(id, line.substring(delimiter + DELIMITER.length()).trim()));
        }
        return results;
    }
}
