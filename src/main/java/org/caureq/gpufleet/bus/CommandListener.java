package org.caureq.gpufleet.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "app.bus", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CommandListener {
    private final ObjectMapper mapper;
    private final CommandHandler handler;

    @RabbitListener(queues = "#{commandQueue.name}")
    public void onMessage(String body) {
        if (body == null || body.isBlank()) {
            log.warn("[Bus] RECV empty command, dropped");
            return;
        }
        CommandMessage message;
        try {
            message = mapper.readValue(body, CommandMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("[Bus] RECV malformed command dropped: {} payload={}", e.getOriginalMessage(), snippet(body));
            return;
        }
        log.info("[Bus] RECV {} inst={} cid={}", message.type(), message.instanceId(), message.correlationId());
        handler.handle(message);
    }

    private static String snippet(String body) {
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
