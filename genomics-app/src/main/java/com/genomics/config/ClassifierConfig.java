package com.genomics.config;

import com.genomics.classifier.ClassifierSettings;
import com.genomics.classifier.EvidencePrecedence;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Detection rules. The tolerance band and the sequence/expression precedence
 * are deployment choices, so both live in application.yml under
 * 'genomics.classifier'.
 */
@Configuration
@ConfigurationProperties(prefix = "genomics.classifier")
public class ClassifierConfig {

    private double tolerance = ClassifierSettings.DEFAULT_TOLERANCE;
    private String ruleVersion = ClassifierSettings.DEFAULT_RULE_VERSION;
    private EvidencePrecedence precedence = EvidencePrecedence.SEQUENCE;

    @Bean
    public ClassifierSettings classifierSettings() {
        return new ClassifierSettings(tolerance, ruleVersion, precedence);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    public double getTolerance() { return tolerance; }
    public void setTolerance(double tolerance) { this.tolerance = tolerance; }

    public String getRuleVersion() { return ruleVersion; }
    public void setRuleVersion(String ruleVersion) { this.ruleVersion = ruleVersion; }

    public EvidencePrecedence getPrecedence() { return precedence; }
    public void setPrecedence(EvidencePrecedence precedence) { this.precedence = precedence; }
}
