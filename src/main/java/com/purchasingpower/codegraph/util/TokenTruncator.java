package com.purchasingpower.codegraph.util;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;
import org.springframework.stereotype.Component;

/**
 * Cuts text down to a token budget using the {@code o200k_base} encoding.
 *
 * <p>Text within the budget is returned unchanged. Longer text keeps its leading tokens and ends
 * with {@link #TRUNCATION_MARKER}; the result never encodes to more than the budget.
 */
@Component
public class TokenTruncator {

    public static final String TRUNCATION_MARKER = "...truncated";

    private final Encoding encoding;
    private final int reservedTokens;

    public TokenTruncator() {
        this.encoding = Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.O200K_BASE);
        this.reservedTokens = encoding.countTokens(TRUNCATION_MARKER);
    }

    public int countTokens(String text) {
        return encoding.countTokens(text);
    }

    public String truncate(String text, int maxTokens) {
        IntArrayList tokens = encoding.encode(text);
        if (tokens.size() <= maxTokens) {
            return text;
        }

        // marker alone does not fit: plain cut
        if (maxTokens < reservedTokens) {
            return fitPrefix(tokens, maxTokens, "", maxTokens);
        }
        return fitPrefix(tokens, maxTokens - reservedTokens, TRUNCATION_MARKER, maxTokens);
    }

    /**
     * Decoding a cut token stream can re-encode to a different length, so shrink until it fits.
     */
    private String fitPrefix(IntArrayList tokens, int keep, String suffix, int maxTokens) {
        for (int size = Math.max(0, keep); size >= 0; size--) {
            String candidate = decodePrefix(tokens, size) + suffix;
            if (encoding.countTokens(candidate) <= maxTokens) {
                return candidate;
            }
        }
        return "";
    }

    private String decodePrefix(IntArrayList tokens, int size) {
        IntArrayList prefix = new IntArrayList(size);
        for (int i = 0; i < size; i++) {
            prefix.add(tokens.get(i));
        }
        return encoding.decode(prefix);
    }
}
