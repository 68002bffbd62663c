package gr.imsi.athenarc.tsdb.query;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    /**
     * "desc" in any case means descending, anything else ascending.
     */
    public static SortDirection fromString(String direction) {
        return direction != null && "DESC".equals(direction.trim().toUpperCase(Locale.ROOT)) ? DESC : ASC;
    }
}
