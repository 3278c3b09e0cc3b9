package io.github.yok.itgluemigrate.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Turns custom asset type slugs (CSV file stems such as {@code ssl-certificates}) into display
 * names such as {@code SSL Certificates}.
 *
 * @author Yasuharu.Okawauchi
 */
public final class DisplayNames {

    private static final Set<String> ACRONYMS =
            Set.of("ssl", "vpn", "wan", "lan", "mdm", "mfa", "otp", "api", "sso", "ad");

    private static final Set<String> SMALL_WORDS =
            Set.of("and", "or", "the", "a", "an", "of", "for", "to", "in", "on");

    private DisplayNames() {
        // Utility class; do not instantiate.
    }

    /**
     * Converts a hyphenated slug into a title-cased display name.
     *
     * <p>
     * Known acronyms are upper-cased. Short connecting words stay lowercase unless they start
     * the name.
     * </p>
     *
     * @param slug slug, for example {@code vpn-and-firewall}
     * @return display name, for example {@code VPN and Firewall}
     */
    public static String slugToDisplayName(String slug) {
        if (StringUtils.isBlank(slug)) {
            return "";
        }
        String[] words = StringUtils.split(slug.replace('-', ' '));
        List<String> out = new ArrayList<>(words.length);
        for (int i = 0; i < words.length; i++) {
            String lower = words[i].toLowerCase(Locale.ROOT);
            if (ACRONYMS.contains(lower)) {
                out.add(lower.toUpperCase(Locale.ROOT));
            } else if (i > 0 && SMALL_WORDS.contains(lower)) {
                out.add(lower);
            } else {
                out.add(StringUtils.capitalize(lower));
            }
        }
        return String.join(" ", out);
    }
}
