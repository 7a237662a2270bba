package org.vadalog.vadacode;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the {@code %%} documentation lines preceding a clause.
 *
 * <pre>
 * %% Direct connection between two nodes.
 * %% @term {string} from the source node
 * %% @term {string} to the target node
 * edge("a", "b").
 * </pre>
 */
public class VadocParser {

    private static final Pattern TAG = Pattern.compile("^@(\\w+)\\s*(?:\\{([^}]*)\\})?\\s*(\\S+)?\\s*(.*)$");

    public static final String EXPORTS = "exports";
    public static final String SILENT = "_silent";
    public static final String TERM = "term";

    /**
     * @param lines raw comment texts, each starting with {@code %%}
     */
    public VadocBlock parse(List<String> lines) {
        StringBuilder description = new StringBuilder();
        List<String[]> tags = new ArrayList<>();

        for (String raw : lines) {
            String line = stripPrefix(raw);
            if (line.startsWith("@")) {
                Matcher matcher = TAG.matcher(line);
                if (matcher.matches()) {
                    tags.add(new String[]{matcher.group(1), matcher.group(2), matcher.group(3), matcher.group(4)});
                    continue;
                }
            }
            if (!tags.isEmpty()) {
                // Continuation of the previous tag description
                String[] last = tags.get(tags.size() - 1);
                last[3] = join(last[3], line);
            } else {
                if (description.length() > 0 && !line.isEmpty()) {
                    description.append('\n');
                }
                description.append(line);
            }
        }

        List<VadocTag> parsedTags = new ArrayList<>();
        for (String[] tag : tags) {
            String type = tag[1] != null ? tag[1].trim() : null;
            parsedTags.add(new VadocTag(tag[0], type, tag[2], tag[3] != null ? tag[3].trim() : ""));
        }
        return new VadocBlock(description.toString().trim(), parsedTags);
    }

    private static String stripPrefix(String raw) {
        String line = raw.trim();
        while (line.startsWith("%")) {
            line = line.substring(1);
        }
        return line.trim();
    }

    private static String join(String first, String second) {
        if (first == null || first.isEmpty()) {
            return second;
        }
        return second.isEmpty() ? first : first + " " + second;
    }
}
