package io.contextrunr.core;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingResult;
import com.knuddels.jtokkit.api.EncodingType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Counts and truncates text by tokens using the CL100K vocabulary.
 * Special-token strings such as {@code <|endoftext|>} are encoded as ordinary text.
 *
 * <p>If the tokenizer fails, both operations fall back to 4 characters per token
 * instead of failing the request.</p>
 */
@Component
public class TokenCounter {

    private static final Logger log = LoggerFactory.getLogger(TokenCounter.class);
    static final int CHARS_PER_TOKEN = 4;

    private final Encoding encoding;

    public TokenCounter() {
        this(Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE));
    }

    TokenCounter(Encoding encoding) {
        this.encoding = encoding;
    }

    /**
     * Number of tokens in the text; zero for null or empty text.
     */
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        try {
            return encoding.countTokensOrdinary(text);
        } catch (RuntimeException e) {
            log.warn("Tokenizer failed, estimating token count: {}", e.getMessage());
            return text.length() / CHARS_PER_TOKEN;
        }
    }

    /**
     * Cuts text down to at most {@code maxTokens} tokens. Text already within
     * budget is returned unchanged, so truncating twice is the same as once.
     */
    public String truncate(String text, int maxTokens) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        int limit = Math.max(0, maxTokens);
        try {
            if (encoding.countTokensOrdinary(text) <= limit) {
                return text;
            }
            EncodingResult result = encoding.encodeOrdinary(text, limit);
            String prefix = encoding.decode(result.getTokens());
            // a cut inside a multi-byte character decodes to a replacement char that may re-encode longer
            while (!prefix.isEmpty() && encoding.countTokensOrdinary(prefix) > limit) {
                prefix = prefix.substring(0, prefix.length() - 1);
            }
            return prefix;
        } catch (RuntimeException e) {
            log.warn("Tokenizer failed, truncating by characters: {}", e.getMessage());
            int maxChars = limit * CHARS_PER_TOKEN;
            return text.length() <= maxChars ? text : text.substring(0, maxChars);
        }
    }
}
