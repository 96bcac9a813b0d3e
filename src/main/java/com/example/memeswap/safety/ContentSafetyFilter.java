package com.example.memeswap.safety;

import com.example.memeswap.config.SafetyFilterProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a candidate label may be shown.
 *
 * <p>A label is rejected when the source flagged it, or when any normalised
 * variant of it contains a blocked term.  Normalisation undoes the usual
 * obfuscations: leetspeak digits and symbols ({@code d@mn}, {@code bull$hit})
 * and letters spaced apart ({@code s h i t}).  Each term is compiled to a
 * pattern in which every letter may be stretched ({@code fuuuuck}) but never
 * shortened, so {@code piss} does not match {@code pistachio}.  The words of
 * a multi-word term may be separated by any whitespace or by none.  Matching
 * is substring containment, so a term also blocks the words it is embedded
 * in.</p>
 *
 * <p>The block-list is compiled once at construction; {@link #isAdmissible}
 * allocates only the label variants and touches no shared mutable state.</p>
 */
@Component
public class ContentSafetyFilter {

    private final boolean enabled;
    private final List<Pattern> terms;

    @Autowired
    public ContentSafetyFilter(SafetyFilterProperties props) {
        this(props.isEnabled(), props.getBlockedTerms());
    }

    public ContentSafetyFilter(boolean enabled, List<String> blockedTerms) {
        this.enabled = enabled;
        Set<String> unique = new LinkedHashSet<>();
        if (blockedTerms != null) {
            for (String raw : blockedTerms) {
                String t = deobfuscate(raw);
                if (!t.isEmpty()) unique.add(t);
            }
        }
        List<Pattern> compiled = new ArrayList<>(unique.size());
        for (String t : unique) {
            compiled.add(stretchPattern(t));
        }
        this.terms = List.copyOf(compiled);
    }

    /**
     * @param label   the candidate's text label, may be {@code null}
     * @param flagged explicit adult/unsafe marker from the source
     * @return {@code false} when flagged or when a blocked term is found
     */
    public boolean isAdmissible(String label, boolean flagged) {
        if (flagged) return false;
        if (!enabled || label == null || label.isBlank()) return true;

        String lower = label.toLowerCase(Locale.ROOT);
        String mapped = deobfuscate(label);
        String joined = joinSpacedLetters(mapped);

        for (Pattern term : terms) {
            if (term.matcher(lower).find() || term.matcher(mapped).find() || term.matcher(joined).find()) {
                return false;
            }
        }
        return true;
    }

    /**
     * "kill" becomes {@code k+i+l{2,}}: each run of a letter matches that
     * many or more of it; a space matches any whitespace, including none.
     */
    static Pattern stretchPattern(String term) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < term.length()) {
            char ch = term.charAt(i);
            int run = 1;
            while (i + run < term.length() && term.charAt(i + run) == ch) run++;
            if (ch == ' ') {
                regex.append("\\s*");
            } else {
                regex.append(ch);
                regex.append(run == 1 ? "+" : "{" + run + ",}");
            }
            i += run;
        }
        return Pattern.compile(regex.toString());
    }

    /**
     * Lower-cases, maps leetspeak to letters and drops every other
     * non-letter; whitespace runs are kept as a single space.
     */
    static String deobfuscate(String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length());
        boolean lastSpace = true;
        for (char ch : s.toLowerCase(Locale.ROOT).toCharArray()) {
            char m = leet(ch);
            if (Character.isLetter(m)) {
                sb.append(m);
                lastSpace = false;
            } else if (Character.isWhitespace(m) && !lastSpace) {
                sb.append(' ');
                lastSpace = true;
            }
        }
        int len = sb.length();
        if (len > 0 && sb.charAt(len - 1) == ' ') sb.setLength(len - 1);
        return sb.toString();
    }

    private static char leet(char ch) {
        switch (ch) {
            case '@': case '4': return 'a';
            case '3': return 'e';
            case '1': case '!': case '|': return 'i';
            case '0': return 'o';
            case '$': case '5': return 's';
            case '7': case '+': return 't';
            default: return ch;
        }
    }

    /** "what the s h i t" becomes "what the shit"; longer words are left alone. */
    static String joinSpacedLetters(String s) {
        if (s.isEmpty()) return s;
        String[] tokens = s.split(" ");
        List<String> out = new ArrayList<>(tokens.length);
        StringBuilder run = new StringBuilder();
        for (String tok : tokens) {
            if (tok.length() == 1) {
                run.append(tok);
                continue;
            }
            if (run.length() > 0) {
                out.add(run.toString());
                run.setLength(0);
            }
            out.add(tok);
        }
        if (run.length() > 0) out.add(run.toString());
        return String.join(" ", out);
    }
}
