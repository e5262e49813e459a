package ru.aritmos.crmbridge.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import ru.aritmos.crmbridge.model.AgentPersona;

/**
 * Настройки агента автоответов по умолчанию ({@code wacrm.persona.*}).
 */
@ConfigurationProperties("wacrm.persona")
public class PersonaProperties {

    private String defaultAgentName = AgentPersona.DEFAULT_AGENT_NAME;
    private String defaultAgentUrl = "";

    public String getDefaultAgentName() {
        return defaultAgentName;
    }

    public void setDefaultAgentName(String defaultAgentName) {
        this.defaultAgentName = (defaultAgentName == null || defaultAgentName.isBlank())
                ? AgentPersona.DEFAULT_AGENT_NAME
                : defaultAgentName.trim();
    }

    public String getDefaultAgentUrl() {
        return defaultAgentUrl;
    }

    public void setDefaultAgentUrl(String defaultAgentUrl) {
        this.defaultAgentUrl = defaultAgentUrl == null ? "" : defaultAgentUrl.trim();
    }

    public AgentPersona defaultPersona() {
        return new AgentPersona(defaultAgentName, defaultAgentUrl);
    }
}
