package com.plagiarism.ai.provider;

import com.plagiarism.ai.config.AiProperties;
import com.plagiarism.common.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 提供商工厂，根据配置选择对应的 Provider。
 */
@Component
@RequiredArgsConstructor
public class AiProviderFactory {

    private final List<AiProvider> providers;
    private final AiProperties properties;

    /**
     * 获取当前配置的提供商。
     */
    public AiProvider getProvider() {
        return getProvider(properties.getProvider());
    }

    public AiProvider getProvider(String providerName) {
        return providers.stream()
                .filter(p -> p.getProviderName().equalsIgnoreCase(providerName))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("未找到大模型提供商: " + providerName
                        + "，可选: " + providers.stream().map(AiProvider::getProviderName)
                        .collect(Collectors.joining(", "))));
    }
}
