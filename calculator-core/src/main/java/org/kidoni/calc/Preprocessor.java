package org.kidoni.calc;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites user input into the canonical spelling the {@link Parser} accepts.
 * <p>
 * The rewrite is purely textual and never fails: malformed input passes through and is rejected by the parser.
 * <ul>
 *  <li>surrounding whitespace is trimmed</li>
 *  <li>{@code ^} is an alias of {@code **}</li>
 *  <li>{@code ln(} (any case) is an alias of {@code log(}</li>
 *  <li>the session names {@code ans} and {@code mem} are accepted in any case</li>
 * </ul>
 * Postfix {@code !} is left alone; the parser handles it as an operator.
 */
public final class Preprocessor {
    private static final Pattern LN_CALL = Pattern.compile("\\bln\\(", Pattern.CASE_INSENSITIVE);
    private static final List<String> CASE_FOLDED_NAMES = List.of("ans", "mem");
    private static final List<Pattern> CASE_FOLDED_PATTERNS = CASE_FOLDED_NAMES.stream()
            .map(name -> Pattern.compile("\\b" + name + "\\b", Pattern.CASE_INSENSITIVE))
            .toList();

    private Preprocessor() {
    }

    public static String preprocess(String text) {
        if (text == null) {
            return "";
        }

        String s = text.strip();
        s = s.replace("^", "**");
        s = LN_CALL.matcher(s).replaceAll("log(");
        for (int i = 0; i < CASE_FOLDED_NAMES.size(); i++) {
            s = CASE_FOLDED_PATTERNS.get(i).matcher(s).replaceAll(Matcher.quoteReplacement(CASE_FOLDED_NAMES.get(i)));
        }
        return s;
    }
}
