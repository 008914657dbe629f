package com.dedupstore.core.index;

import com.dedupstore.core.config.IndexingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into distinct lower-case keywords. The same rules apply to indexed content and
 * to search terms, so a query word matches exactly when it would have been indexed.
 */
@Component
@RequiredArgsConstructor
public class KeywordTokenizer {
    
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");
    
    private final IndexingProperties indexingProperties;
    
    public Set<String> tokenize(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return keywords;
        }
        
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (accept(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }
    
    public Set<String> normalizeQuery(Collection<String> terms) {
        Set<String> keywords = new LinkedHashSet<>();
        if (terms == null) {
            return keywords;
        }
        for (String term : terms) {
            keywords.addAll(tokenize(term));
        }
        return keywords;
    }
    
    private boolean accept(String word) {
        int length = word.length();
        return length >= indexingProperties.getMinWordLength()
            && length <= indexingProperties.getMaxWordLength()
            && !indexingProperties.getStopWords().contains(word);
    }
}
