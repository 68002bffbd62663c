package gr.imsi.athenarc.tsdb.datasource.rrd.tag;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File name encoding of tags: {@code measurement_key1-value1_key2-value2.rrd},
 * keys sorted. Separators inside a key or value become dots.
 */
final class TagEncoding {

    static final char TAG_SEPARATOR = '_';
    static final char TAG_VALUE_SEPARATOR = '-';
    static final String EXTENSION = ".rrd";

    private static final Pattern TAG_PAIR = Pattern.compile("([^_-]+)-([^_-]+)");

    private TagEncoding() {
    }

    static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9\\-_.]", "").trim();
    }

    static String sanitizeTagValue(String value) {
        return value.replace(TAG_SEPARATOR, '.').replace(TAG_VALUE_SEPARATOR, '.');
    }

    static String encode(String measurement, Map<String, String> tags) {
        StringBuilder filename = new StringBuilder(measurement);
        for (Map.Entry<String, String> tag : new TreeMap<>(tags).entrySet()) {
            filename.append(TAG_SEPARATOR)
                .append(sanitizeTagValue(tag.getKey()))
                .append(TAG_VALUE_SEPARATOR)
                .append(sanitizeTagValue(tag.getValue()));
        }
        return sanitize(filename.toString()) + EXTENSION;
    }

    static String stripExtension(String filename) {
        return filename.endsWith(EXTENSION) ? filename.substring(0, filename.length() - EXTENSION.length()) : filename;
    }

    static Map<String, String> parseTags(String filename) {
        Map<String, String> tags = new LinkedHashMap<>();
        Matcher matcher = TAG_PAIR.matcher(stripExtension(filename));
        while (matcher.find()) {
            tags.put(matcher.group(1), matcher.group(2));
        }
        return tags;
    }

    /**
     * The measurement is everything before the first tag pair.
     */
    static String parseMeasurement(String filename) {
        String basename = stripExtension(filename);
        int firstValueSeparator = basename.indexOf(TAG_VALUE_SEPARATOR);
        if (firstValueSeparator < 0) {
            return basename;
        }
        String head = basename.substring(0, firstValueSeparator);
        int lastTagSeparator = head.lastIndexOf(TAG_SEPARATOR);
        return lastTagSeparator < 0 ? head : head.substring(0, lastTagSeparator);
    }
}
