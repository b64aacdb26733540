package com.eainde.sos.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a source URL belongs to an allow-listed domain suffix.
 *
 * <p>Suffixes match on label boundaries: {@code gov.in} accepts {@code 112.gov.in} and
 * {@code gov.in} itself, but not {@code notgov.in}. URLs without a scheme are read as https.</p>
 */
public class TrustedDomainPolicy {

    private final List<String> suffixes;

    public TrustedDomainPolicy(List<String> suffixes) {
        this.suffixes = suffixes.stream()
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .map(s -> s.startsWith(".") ? s.substring(1) : s)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }

    public boolean isTrusted(String sourceUrl) {
        String host = hostOf(sourceUrl);
        if (host == null) {
            return false;
        }
        for (String suffix : suffixes) {
            if (host.equals(suffix) || host.endsWith("." + suffix)) {
                return true;
            }
        }
        return false;
    }

    public List<String> getSuffixes() {
        return suffixes;
    }

    static String hostOf(String sourceUrl) {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            return null;
        }
        String candidate = sourceUrl.trim();
        if (!candidate.contains("://")) {
            candidate = "https://" + candidate;
        }
        try {
            String host = new URI(candidate).getHost();
            if (host == null) {
                return null;
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
