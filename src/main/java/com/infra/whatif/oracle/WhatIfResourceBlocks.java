package com.infra.whatif.oracle;

import com.infra.whatif.model.ChangeRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts raw What-If output down to the resource blocks of selected changes.
 * A block starts at a two-space indented change symbol followed by a resource id
 * and runs until the next block header or the next unindented line.
 */
final class WhatIfResourceBlocks {

    // "  ~ Microsoft.Storage/storageAccounts/stapp [2023-01-01]"; legend lines carry no '/'
    private static final Pattern HEADER = Pattern.compile("^  [+\\-~=*x!] (\\S+/\\S+)(?: \\[[^\\]]*])?\\s*$");

    private static final String SUMMARY_PREFIX = "Resource changes:";

    private WhatIfResourceBlocks() {}

    /**
     * @return the What-If text with only the blocks of {@code retained} kept, or null when
     *         any retained change has no block in the text
     */
    static String retain(String whatIf, List<ChangeRecord> retained) {
        if (whatIf == null || whatIf.isBlank() || retained.isEmpty()) {
            return null;
        }

        List<String> matchedNames = new ArrayList<>();
        StringBuilder out = new StringBuilder();
        boolean inBlock = false;
        boolean keepBlock = false;

        for (String line : whatIf.split("\\R", -1)) {
            Matcher header = HEADER.matcher(line);
            if (header.matches()) {
                inBlock = true;
                ChangeRecord record = find(header.group(1), retained);
                keepBlock = record != null;
                if (keepBlock) {
                    matchedNames.add(record.getName().toLowerCase(Locale.ROOT));
                }
            } else if (!line.isEmpty() && !line.startsWith(" ")) {
                inBlock = false;
            }

            // Totals count excluded changes too
            if (line.startsWith(SUMMARY_PREFIX)) {
                continue;
            }
            if (!inBlock || keepBlock) {
                out.append(line).append('\n');
            }
        }

        for (ChangeRecord record : retained) {
            if (record.getName() == null || !matchedNames.contains(record.getName().toLowerCase(Locale.ROOT))) {
                return null;
            }
        }
        return out.toString().strip();
    }

    private static ChangeRecord find(String resourceId, List<ChangeRecord> retained) {
        String id = resourceId.toLowerCase(Locale.ROOT);
        for (ChangeRecord record : retained) {
            if (record.getName() == null || record.getName().isBlank()) continue;
            String name = record.getName().toLowerCase(Locale.ROOT);
            if (id.endsWith("/" + name)) {
                return record;
            }
        }
        return null;
    }
}
