package com.twinforge.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts generated files from free-form model or CLI output.
 * <p>
 * Recognised layouts:
 * <pre>
 * FILE: main.py
 * ```python
 * ...
 * ```
 *
 * ```javascript:src/App.jsx
 * ...
 * ```
 * </pre>
 * A {@code # path} or {@code // path} line outside a fence also names the next block.
 * Paths are normalised relative to the target root; absolute and parent-escaping paths are dropped.
 */
@Component
public class ArtifactParser {

    private static final Logger log = LoggerFactory.getLogger(ArtifactParser.class);

    private static final List<String> STRIPPED_PREFIXES = List.of(
            "output/frontend/", "output/backend/", "output/", "frontend/", "backend/");

    public Map<String, String> parse(String output) {
        var files = new LinkedHashMap<String, String>();
        if (output == null || output.isBlank()) {
            return files;
        }

        String currentFile = null;
        boolean inCodeBlock = false;
        List<String> codeLines = new ArrayList<>();

        for (String line : output.split("\n", -1)) {
            String stripped = line.strip();

            if (!inCodeBlock && stripped.startsWith("FILE:")) {
                flush(files, currentFile, codeLines);
                currentFile = normalizePath(stripped.substring("FILE:".length()));
                continue;
            }

            if (stripped.startsWith("```")) {
                if (inCodeBlock) {
                    inCodeBlock = false;
                    flush(files, currentFile, codeLines);
                    currentFile = null;
                } else {
                    inCodeBlock = true;
                    int colon = stripped.indexOf(':');
                    if (colon > 0) {
                        currentFile = normalizePath(stripped.substring(colon + 1));
                    }
                }
                continue;
            }

            if (!inCodeBlock && (stripped.startsWith("# ") || stripped.startsWith("// "))) {
                String candidate = stripped.substring(stripped.indexOf(' ') + 1).strip();
                if (candidate.contains(".") && !candidate.contains(" ")) {
                    flush(files, currentFile, codeLines);
                    currentFile = normalizePath(candidate);
                    continue;
                }
            }

            if (inCodeBlock && currentFile != null) {
                codeLines.add(line);
            }
        }
        // unterminated final block
        flush(files, currentFile, codeLines);

        log.debug("Parsed {} file(s) from {} chars of output", files.size(), output.length());
        return files;
    }

    /**
     * Strips backticks, quotes and well-known target prefixes.
     *
     * @return the normalised relative path, or null if the path is unusable
     */
    String normalizePath(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.strip().replace("`", "").replace("\"", "").replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        for (String prefix : STRIPPED_PREFIXES) {
            if (normalized.startsWith(prefix)) {
                normalized = normalized.substring(prefix.length());
                break;
            }
        }
        if (normalized.isEmpty() || normalized.startsWith("/") || normalized.matches("^[A-Za-z]:/.*")
                || normalized.equals("..") || normalized.startsWith("../") || normalized.contains("/../")) {
            log.debug("Rejecting unusable artifact path '{}'", raw);
            return null;
        }
        return normalized;
    }

    private static void flush(Map<String, String> files, String currentFile, List<String> codeLines) {
        if (currentFile != null && !codeLines.isEmpty()) {
            files.put(currentFile, String.join("\n", codeLines));
        }
        codeLines.clear();
    }
}
