package com.example.shifttrade.service;

import com.example.shifttrade.config.EligibilityRulesProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides from the title alone whether a shift can be traded.
 * Exclude patterns win over allow patterns; a title matching nothing is not tradable.
 */
@Slf4j
@Component
public class EligibilityClassifier {

    private final List<Pattern> excludePatterns;
    private final List<Pattern> allowPatterns;

    public EligibilityClassifier(EligibilityRulesProperties rules) {
        this.excludePatterns = compile(rules.getExclude());
        this.allowPatterns = compile(rules.getAllow());
        log.info("Eligibility rules loaded: {} exclude, {} allow patterns", excludePatterns.size(), allowPatterns.size());
    }

    public boolean classify(String title) {
        if (title == null || title.isBlank()) {
            return false;
        }
        for (Pattern exclude : excludePatterns) {
            if (exclude.matcher(title).find()) {
                return false;
            }
        }
        return allowPatterns.stream().anyMatch(allow -> allow.matcher(title).find());
    }

    private static List<Pattern> compile(List<String> patterns) {
        return patterns.stream()
                .map(pattern -> Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }
}
