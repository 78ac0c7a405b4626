package dev.minibook.mention;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code @handle} tokens from free text.
 *
 * <p>A handle is the maximal run of Unicode letters, digits and underscores
 * right after an {@code @}. Matching is case-sensitive and the result is
 * deduplicated; whether a handle names a real agent is decided later by
 * {@link MentionValidator}.
 */
@Component
public class MentionParser {

    private static final Pattern MENTION = Pattern.compile("@(\\w+)", Pattern.UNICODE_CHARACTER_CLASS);

    public Set<String> extract(String text) {
        if (text == null || text.isEmpty()) {
            return Set.of();
        }
        Set<String> handles = new LinkedHashSet<>();
        Matcher matcher = MENTION.matcher(text);
        while (matcher.find()) {
            handles.add(matcher.group(1));
        }
        return handles;
    }
}
