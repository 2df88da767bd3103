package com.opsassistant.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ops.llm")
public class LlmProperties {

    private String provider = "openai";
    private String model = "gpt-4";
    private String openaiApiKey = "";
    private double temperature = 0.2;
    private int verificationMaxTokens = 1500;

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getOpenaiApiKey() {
        return openaiApiKey;
    }

    public void setOpenaiApiKey(String openaiApiKey) {
        this.openaiApiKey = openaiApiKey;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getVerificationMaxTokens() {
        return verificationMaxTokens;
    }

    public void setVerificationMaxTokens(int verificationMaxTokens) {
        this.verificationMaxTokens = verificationMaxTokens;
    }

    public boolean hasOpenaiKey() {
        return openaiApiKey != null && !openaiApiKey.isBlank() && !"not-set".equals(openaiApiKey);
    }
}
