package com.projecttree.order.items;

import com.projecttree.order.model.ProjectItemIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Parser for ordered item list files.
 *
 * Format:
 * - One evaluated include per line, in display order: Folder1/FileA.cs
 * - Either separator may be used: Folder1\FileB.cs
 * - Comments: # comment
 * - Wildcards are not evaluated includes and are rejected: src/*.cs
 */
public class OrderedItemsParser {
    private static final Logger log = LoggerFactory.getLogger(OrderedItemsParser.class);

    private static final String WILDCARDS = "*?";

    public OrderedItemsDocument parse(Path listFile) throws IOException {
        List<String> lines = Files.readAllLines(listFile, StandardCharsets.UTF_8);
        return parse(lines);
    }

    public OrderedItemsDocument parse(List<String> lines) {
        OrderedItemsDocument doc = new OrderedItemsDocument();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = stripBom(line).trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            try {
                ProjectItemIdentity item = parseLine(trimmed);
                if (!doc.addItem(item)) {
                    doc.addWarning("Line " + lineNum + ": duplicate include " + trimmed);
                }
                log.debug("Parsed include {}: {}", lineNum, trimmed);
            } catch (IllegalArgumentException e) {
                doc.addError("Line " + lineNum + ": " + e.getMessage());
                log.warn("Failed to parse item list line {}: {}", lineNum, e.getMessage());
            }
        }

        return doc;
    }

    private ProjectItemIdentity parseLine(String line) {
        for (char c : line.toCharArray()) {
            if (WILDCARDS.indexOf(c) >= 0) {
                throw new IllegalArgumentException("Wildcard include is not an evaluated include: " + line);
            }
        }
        return ProjectItemIdentity.of(line);
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}
