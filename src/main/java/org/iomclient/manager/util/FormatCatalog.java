package org.iomclient.manager.util;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Display format families that mark a numeric column as a calendar value.
 * Date formats hold days since {@link #EPOCH}, datetime formats hold seconds.
 */
public final class FormatCatalog {

    public static final LocalDate EPOCH = LocalDate.of(1960, 1, 1);

    // ISO-8601 formats forced onto calendar columns before a CSV export
    public static final String DEFAULT_DATE_NAME = "E8601DA";
    public static final int DEFAULT_DATE_LENGTH = 10;
    public static final int DEFAULT_DATE_PRECISION = 0;
    public static final String DEFAULT_DATETIME_NAME = "E8601DT";
    public static final int DEFAULT_DATETIME_LENGTH = 26;
    public static final int DEFAULT_DATETIME_PRECISION = 6;

    private static final Set<String> DATE_FORMATS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "B8601DA", "DATE", "DATEJUL", "DAY", "DDMMYY", "DDMMYYB", "DDMMYYC", "DDMMYYD",
            "DDMMYYN", "DDMMYYP", "DDMMYYS", "DOWNAME", "E8601DA", "EURDFDD", "EURDFDE", "EURDFDN",
            "EURDFDWN", "EURDFMN", "EURDFMY", "EURDFWDX", "EURDFWKX", "HDATE", "HEBDATE", "JULDAY",
            "JULIAN", "MINGUO", "MMDDYY", "MMDDYYB", "MMDDYYC", "MMDDYYD", "MMDDYYN", "MMDDYYP",
            "MMDDYYS", "MMYY", "MMYYC", "MMYYD", "MMYYN", "MMYYP", "MMYYS", "MONNAME", "MONTH", "MONYY",
            "NENGO", "NLDATE", "NLDATEL", "NLDATEM", "NLDATEMD", "NLDATEMDL", "NLDATEMDM", "NLDATEMDS",
            "NLDATEMN", "NLDATES", "NLDATEW", "NLDATEWN", "NLDATEYM", "NLDATEYML", "NLDATEYMM",
            "NLDATEYMS", "NLDATEYQ", "NLDATEYQL", "NLDATEYQM", "NLDATEYQS", "NLDATEYR", "NLDATEYW",
            "PDJULG", "PDJULI", "QTR", "QTRR", "WEEKDATE", "WEEKDATX", "WEEKDAY", "WEEKU", "WEEKV",
            "WEEKW", "WORDDATE", "WORDDATX", "YEAR", "YYMM", "YYMMC", "YYMMD", "YYMMDD", "YYMMDDB",
            "YYMMDDC", "YYMMDDD", "YYMMDDN", "YYMMDDP", "YYMMDDS", "YYMMN", "YYMMP", "YYMMS", "YYMON",
            "YYQ", "YYQC", "YYQD", "YYQN", "YYQP", "YYQR", "YYQRC", "YYQRD", "YYQRN", "YYQRP", "YYQRS",
            "YYQS", "YYQZ", "YYWEEKU", "YYWEEKV", "YYWEEKW")));

    private static final Set<String> DATETIME_FORMATS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "B8601DN", "B8601DT", "B8601DX", "B8601DZ", "B8601LX", "DATEAMPM", "DATETIME", "DTDATE",
            "DTMONYY", "DTWKDATX", "DTYEAR", "DTYYQC", "E8601DN", "E8601DT", "E8601DX", "E8601DZ",
            "E8601LX", "EURDFDT", "IS8601DN", "IS8601DT", "IS8601DZ", "IS8601LX", "MDYAMPM", "NLDATM",
            "NLDATMAP", "NLDATMDT", "NLDATML", "NLDATMM", "NLDATMMD", "NLDATMMDL", "NLDATMMDM",
            "NLDATMMDS", "NLDATMMN", "NLDATMS", "NLDATMW", "NLDATMWN", "NLDATMWZ", "NLDATMYM",
            "NLDATMYML", "NLDATMYMM", "NLDATMYMS", "NLDATMYQ", "NLDATMYQL", "NLDATMYQM", "NLDATMYQS",
            "NLDATMYR", "NLDATMYW", "NLDATMZ")));

    private FormatCatalog() {
    }

    public static boolean isDateFormat(String formatName) {
        return formatName != null && DATE_FORMATS.contains(normalize(formatName));
    }

    public static boolean isDatetimeFormat(String formatName) {
        return formatName != null && DATETIME_FORMATS.contains(normalize(formatName));
    }

    private static String normalize(String formatName) {
        return formatName.trim().toUpperCase(Locale.ROOT);
    }
}
