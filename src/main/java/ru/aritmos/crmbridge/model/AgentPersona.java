package ru.aritmos.crmbridge.model;

import io.micronaut.core.annotation.Introspected;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Агент, от имени которого генерируются автоответы в чате.
 */
@Serdeable
@Introspected
@Schema(name = "AgentPersona", description = "Агент автоответов")
public record AgentPersona(
        @Schema(description = "Имя агента") String agentName,
        @Schema(description = "URL внешнего агента (если используется)") String agentUrl
) {

    public static final String DEFAULT_AGENT_NAME = "Smartbots";

    public AgentPersona {
        agentName = (agentName == null || agentName.isBlank()) ? DEFAULT_AGENT_NAME : agentName.trim();
        agentUrl = agentUrl == null ? "" : agentUrl.trim();
    }
}
