package com.example.shifttrade.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Title pattern tables, matched case-insensitively. Order matters: any exclude match
 * makes the title untradable before the allow list is consulted.
 */
@Data
@ConfigurationProperties(prefix = "trade.eligibility")
public class EligibilityRulesProperties {

    private List<String> exclude = new ArrayList<>(List.of(
            "trauma",
            "ultrasound",
            "\\bUS\\b",
            "sick\\s*call"
    ));

    private List<String> allow = new ArrayList<>(List.of(
            "\\bday\\s*[- ]?\\s*([123])\\b",
            "\\bd([123])\\b",
            "\\beve?(ning)?\\s*[- ]?\\s*([123])\\b",
            "\\be([123])\\b",
            "\\bnight\\s*[- ]?\\s*([123])\\b",
            "\\bn([123])\\b",
            "\\bpod\\s*[- ]?\\s*a\\s*[- ]?\\s*([12])\\b",
            "\\bpod\\s*[- ]?\\s*b\\s*[- ]?\\s*([12])\\b",
            "\\bpoda\\s*[- ]?\\s*([12])\\b",
            "\\bpodb\\s*[- ]?\\s*([12])\\b",
            "\\bside\\b",
            "\\b([abc])\\s*([12])\\b"
    ));
}
