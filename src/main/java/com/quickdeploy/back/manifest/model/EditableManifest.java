package com.quickdeploy.back.manifest.model;

import com.quickdeploy.back.common.error.ManifestParseException;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlPosition;

/**
 * fastly.toml kept as its original text. Edits rewrite only the line holding the edited key,
 * so comments, ordering and formatting elsewhere survive the round trip byte for byte.
 */
public class EditableManifest {

    public static final String SERVICE_ID_KEY = "service_id";

    private String text;
    private TomlParseResult parsed;

    public EditableManifest(String text) {
        this.text = text;
        this.parsed = parse(text);
    }

    public String getServiceId() {
        Object value = parsed.get(SERVICE_ID_KEY);
        return value == null ? null : value.toString();
    }

    public void setServiceId(String serviceId) {
        String assignment = quote(serviceId);
        TomlPosition position = parsed.inputPositionOf(SERVICE_ID_KEY);
        String updated = position == null
                ? insertTopLevel(SERVICE_ID_KEY + " = " + assignment)
                : replaceValue(position, assignment);

        TomlParseResult reparsed = parse(updated);
        if (!serviceId.equals(reparsed.getString(SERVICE_ID_KEY))) {
            throw new ManifestParseException("Unable to set " + SERVICE_ID_KEY + " in manifest");
        }
        this.text = updated;
        this.parsed = reparsed;
    }

    public String render() {
        return text;
    }

    private String replaceValue(TomlPosition position, String value) {
        int lineStart = lineOffset(position.line());
        int lineEnd = lineEnd(lineStart);
        String line = text.substring(lineStart, lineEnd);

        int equals = line.indexOf('=', position.column() - 1);
        if (equals < 0) {
            throw new ManifestParseException("Unable to locate " + SERVICE_ID_KEY + " value in manifest");
        }
        int valueStart = equals + 1;
        while (valueStart < line.length() && (line.charAt(valueStart) == ' ' || line.charAt(valueStart) == '\t')) {
            valueStart++;
        }
        int valueEnd = valueEnd(line, valueStart);

        String rewritten = line.substring(0, valueStart) + value + line.substring(valueEnd);
        return text.substring(0, lineStart) + rewritten + text.substring(lineEnd);
    }

    private static int valueEnd(String line, int start) {
        if (line.startsWith("\"\"\"", start) || line.startsWith("'''", start)) {
            throw new ManifestParseException("Multi-line " + SERVICE_ID_KEY + " values are not supported");
        }
        if (start < line.length() && (line.charAt(start) == '"' || line.charAt(start) == '\'')) {
            char quote = line.charAt(start);
            int i = start + 1;
            while (i < line.length()) {
                char c = line.charAt(i);
                if (quote == '"' && c == '\\') {
                    i += 2;
                    continue;
                }
                if (c == quote) {
                    return i + 1;
                }
                i++;
            }
            return line.length();
        }
        int i = start;
        while (i < line.length() && !Character.isWhitespace(line.charAt(i)) && line.charAt(i) != '#') {
            i++;
        }
        return i;
    }

    /**
     * Top-level keys must precede the first table header, so the line goes right before it.
     */
    private String insertTopLevel(String assignment) {
        String newline = text.contains("\r\n") ? "\r\n" : "\n";
        int header = firstTableHeaderOffset();
        if (header < 0) {
            String separator = text.isEmpty() || text.endsWith("\n") ? "" : newline;
            return text + separator + assignment + newline;
        }
        return text.substring(0, header) + assignment + newline + text.substring(header);
    }

    /**
     * Offset of the line holding the first table header: a '[' that starts a line outside
     * any string, comment, array or inline table.
     */
    private int firstTableHeaderOffset() {
        int depth = 0;
        int lineStart = 0;
        boolean lineBlank = true;
        String delimiter = null;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (delimiter != null) {
                if (c == '\\' && delimiter.charAt(0) == '"') {
                    i += 2;
                    continue;
                }
                if (text.startsWith(delimiter, i)) {
                    i += delimiter.length();
                    delimiter = null;
                    continue;
                }
                if (c == '\n') {
                    lineStart = i + 1;
                    lineBlank = true;
                }
                i++;
                continue;
            }
            switch (c) {
                case '\n' -> {
                    lineStart = i + 1;
                    lineBlank = true;
                    i++;
                    continue;
                }
                case ' ', '\t', '\r' -> {
                    i++;
                    continue;
                }
                case '#' -> {
                    int newline = text.indexOf('\n', i);
                    i = newline < 0 ? text.length() : newline;
                    continue;
                }
                case '"', '\'' -> {
                    delimiter = text.startsWith(String.valueOf(c).repeat(3), i)
                            ? String.valueOf(c).repeat(3)
                            : String.valueOf(c);
                    lineBlank = false;
                    i += delimiter.length();
                    continue;
                }
                case '[', '{' -> {
                    if (c == '[' && depth == 0 && lineBlank) {
                        return lineStart;
                    }
                    depth++;
                }
                case ']', '}' -> depth = Math.max(0, depth - 1);
                default -> {
                }
            }
            lineBlank = false;
            i++;
        }
        return -1;
    }

    /** Offset of the first character of a 1-based line. */
    private int lineOffset(int line) {
        int offset = 0;
        for (int i = 1; i < line; i++) {
            offset = nextLine(lineEnd(offset));
        }
        return offset;
    }

    /** End of the line content, excluding its terminator. */
    private int lineEnd(int lineStart) {
        int newline = text.indexOf('\n', lineStart);
        int end = newline < 0 ? text.length() : newline;
        if (end > lineStart && text.charAt(end - 1) == '\r') {
            end--;
        }
        return end;
    }

    private int nextLine(int lineEnd) {
        int newline = text.indexOf('\n', lineEnd);
        return newline < 0 ? text.length() : newline + 1;
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static TomlParseResult parse(String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new ManifestParseException("Unable to parse manifest: " + result.errors().get(0).toString());
        }
        return result;
    }
}
