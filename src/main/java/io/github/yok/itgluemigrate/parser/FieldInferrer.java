package io.github.yok.itgluemigrate.parser;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Infers custom asset field types from column names and sampled values.
 *
 * <p>
 * Rules are applied in priority order and the first match wins:
 * </p>
 * <ol>
 * <li>column name looks like a secret → {@link FieldType#PASSWORD}</li>
 * <li>column name looks like a one-time-password seed → {@link FieldType#TOTP}</li>
 * <li>all values are boolean words → {@link FieldType#CHECKBOX}</li>
 * <li>all values are numeric → {@link FieldType#NUMBER}</li>
 * <li>all values are dates → {@link FieldType#DATE}</li>
 * <li>few distinct values that mostly recur → {@link FieldType#SELECT}</li>
 * <li>at least half the values are multi-line or longer than 255 characters →
 * {@link FieldType#TEXTBOX}</li>
 * <li>otherwise {@link FieldType#TEXT}</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FieldInferrer {

    private static final Pattern PASSWORD_NAME =
            Pattern.compile("password|secret|key|credential|token", Pattern.CASE_INSENSITIVE);

    private static final Pattern TOTP_NAME =
            Pattern.compile("totp|otp|mfa|2fa|two.?factor", Pattern.CASE_INSENSITIVE);

    private static final Set<String> BOOLEAN_WORDS = ImmutableSet.of("true", "false", "yes", "no",
            "1", "0", "on", "off", "enabled", "disabled");

    private static final Pattern NUMBER =
            Pattern.compile("^-?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    private static final List<Pattern> DATE_PATTERNS = List.of(
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}"
                    + "([T ]\\d{2}:\\d{2}(:\\d{2}(\\.\\d+)?)?(Z|[+-]\\d{2}:?\\d{2})?)?$"),
            Pattern.compile("^\\d{1,2}/\\d{1,2}/\\d{4}"
                    + "( \\d{1,2}:\\d{2}(:\\d{2})?( ?[AaPp][Mm])?)?$"),
            Pattern.compile("^\\d{4}/\\d{2}/\\d{2}$"),
            Pattern.compile("^\\d{2}-\\d{2}-\\d{4}$"));

    static final int MAX_SELECT_OPTIONS = 10;
    static final double MIN_REPEAT_RATIO = 0.5;
    static final int TEXTBOX_LENGTH = 255;
    static final int SHOW_IN_LIST_COUNT = 3;
    static final int SAMPLE_ROWS = 20;
    static final int SAMPLE_VALUES = 5;

    private static final Pattern SEPARATORS = Pattern.compile("[/\\\\-]");
    private static final Pattern DISALLOWED = Pattern.compile("[^a-zA-Z0-9\\s_]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern UNDERSCORES = Pattern.compile("_+");

    /**
     * Converts a column header into a snake_case field key.
     *
     * @param columnName header text, for example {@code "Serial Number / Tag"}
     * @return key such as {@code serial_number_tag}; {@code "field"} if nothing usable remains
     */
    public static String columnNameToKey(String columnName) {
        String key = StringUtils.trimToEmpty(columnName);
        key = SEPARATORS.matcher(key).replaceAll("_");
        key = DISALLOWED.matcher(key).replaceAll("");
        key = WHITESPACE.matcher(key).replaceAll("_");
        key = UNDERSCORES.matcher(key).replaceAll("_");
        key = StringUtils.strip(key.toLowerCase(Locale.ROOT), "_");
        return key.isEmpty() ? "field" : key;
    }

    /**
     * Infers the type of one column.
     *
     * @param columnName column header
     * @param values column values; {@code null} and blank entries are ignored by value rules
     * @return inferred type
     */
    public FieldType inferFieldType(String columnName, Collection<String> values) {
        String name = StringUtils.defaultString(columnName);
        if (PASSWORD_NAME.matcher(name).find()) {
            return FieldType.PASSWORD;
        }
        if (TOTP_NAME.matcher(name).find()) {
            return FieldType.TOTP;
        }

        List<String> present = nonEmpty(values);
        if (present.isEmpty()) {
            return FieldType.TEXT;
        }
        if (present.stream().allMatch(v -> BOOLEAN_WORDS.contains(v.toLowerCase(Locale.ROOT)))) {
            return FieldType.CHECKBOX;
        }
        if (present.stream().allMatch(v -> NUMBER.matcher(v).matches())) {
            return FieldType.NUMBER;
        }
        if (present.stream().allMatch(FieldInferrer::isDate)) {
            return FieldType.DATE;
        }
        if (isSelect(present)) {
            return FieldType.SELECT;
        }
        long multiline = present.stream()
                .filter(v -> v.indexOf('\n') >= 0 || v.length() > TEXTBOX_LENGTH).count();
        if (multiline > 0 && multiline * 2 >= present.size()) {
            return FieldType.TEXTBOX;
        }
        return FieldType.TEXT;
    }

    /**
     * Infers definitions for the given columns.
     *
     * @param columns column headers in output order
     * @param rows rows keyed by column header
     * @param skipColumns headers to leave out (metadata columns)
     * @return one definition per kept column, in column order
     */
    public List<FieldDefinition> inferSchema(List<String> columns, List<Map<String, String>> rows,
            Set<String> skipColumns) {
        List<FieldDefinition> definitions = new ArrayList<>();
        for (String column : columns) {
            if (skipColumns.contains(column)) {
                continue;
            }
            List<String> values = rows.stream().map(r -> r.get(column))
                    .collect(Collectors.toList());
            FieldType type = inferFieldType(column, values);

            FieldDefinition def = new FieldDefinition(columnNameToKey(column), column, type);
            def.setRequired(!rows.isEmpty() && values.stream().allMatch(StringUtils::isNotBlank));
            def.setShowInList(definitions.size() < SHOW_IN_LIST_COUNT);
            if (type == FieldType.SELECT) {
                def.setOptions(new ArrayList<>(new TreeSet<>(nonEmpty(values))));
            }
            def.setSampleValues(sampleValues(values));
            definitions.add(def);
            log.debug("Inferred field. column={}, key={}, type={}, required={}", column,
                    def.getKey(), type.getValue(), def.isRequired());
        }
        return definitions;
    }

    private static boolean isDate(String value) {
        return DATE_PATTERNS.stream().anyMatch(p -> p.matcher(value).matches());
    }

    private static boolean isSelect(List<String> present) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String v : present) {
            counts.merge(v, 1, Integer::sum);
        }
        if (counts.size() > MAX_SELECT_OPTIONS) {
            return false;
        }
        int repeated = counts.values().stream().filter(c -> c > 1).mapToInt(Integer::intValue)
                .sum();
        return (double) repeated / present.size() >= MIN_REPEAT_RATIO;
    }

    private static List<String> sampleValues(List<String> values) {
        Set<String> samples = new LinkedHashSet<>();
        for (String v : values.subList(0, Math.min(SAMPLE_ROWS, values.size()))) {
            if (StringUtils.isNotBlank(v)) {
                samples.add(v.trim());
                if (samples.size() == SAMPLE_VALUES) {
                    break;
                }
            }
        }
        return new ArrayList<>(samples);
    }

    private static List<String> nonEmpty(Collection<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) {
            return out;
        }
        for (String v : values) {
            if (StringUtils.isNotBlank(v)) {
                out.add(v.trim());
            }
        }
        return out;
    }
}
