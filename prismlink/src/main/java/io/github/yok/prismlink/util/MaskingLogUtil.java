package io.github.yok.prismlink.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Utility for masking credentials before they reach the log.
 *
 * <p>
 * Client secrets, refresh tokens and bearer tokens are replaced with a fixed mask. Form bodies and
 * authorization headers are rewritten in place while the surrounding text is kept for
 * troubleshooting.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    /**
     * Pattern that matches secret-bearing parameters in form-encoded bodies.
     */
    private static final Pattern FORM_SECRET_PATTERN =
            Pattern.compile("(?i)((?:client_secret|refresh_token|access_token)=)([^&]+)");

    /**
     * Pattern that matches the credential part of an authorization header value.
     */
    private static final Pattern BEARER_PATTERN = Pattern.compile("(?i)(bearer\\s+)(\\S+)");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks a generic sensitive text.
     *
     * @param value raw text
     * @return masked text, or {@code null} when input is {@code null}
     */
    public static String maskText(String value) {
        if (value == null) {
            return null;
        }
        if (value.isEmpty()) {
            return value;
        }
        return "***";
    }

    /**
     * Masks secret parameters in a form-encoded request body.
     *
     * @param form form body such as {@code grant_type=refresh_token&refresh_token=abc}
     * @return masked body, or {@code null} when input is {@code null}
     */
    public static String maskForm(String form) {
        if (form == null) {
            return null;
        }
        Matcher matcher = FORM_SECRET_PATTERN.matcher(form);
        return matcher.replaceAll("$1***");
    }

    /**
     * Masks the token of an {@code Authorization} header value.
     *
     * @param header header value such as {@code Bearer eyJ...}
     * @return masked header value, or {@code null} when input is {@code null}
     */
    public static String maskAuthorization(String header) {
        if (header == null) {
            return null;
        }
        return BEARER_PATTERN.matcher(header).replaceAll("$1***");
    }
}
