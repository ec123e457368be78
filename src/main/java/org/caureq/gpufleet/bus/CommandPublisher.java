package org.caureq.gpufleet.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.config.AppProps;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Best-effort publisher. Callers persist their intent first, so a message that
 * cannot be sent only costs latency until the next job tick.
 */
@Component
@Slf4j
public class CommandPublisher {
    private final ObjectProvider<RabbitTemplate> rabbit;
    private final ObjectMapper mapper;
    private final AppProps props;

    public CommandPublisher(ObjectProvider<RabbitTemplate> rabbit, ObjectMapper mapper, AppProps props) {
        this.rabbit = rabbit;
        this.mapper = mapper;
        this.props = props;
    }

    /** @return true when the message was handed to the broker */
    public boolean publish(CommandMessage message) {
        var template = rabbit.getIfAvailable();
        if (!props.bus().enabled() || template == null) {
            log.debug("[Bus] disabled, {} for {} left to the job loops", message.type(), message.instanceId());
            return false;
        }
        try {
            template.convertAndSend(props.bus().channel(), "", mapper.writeValueAsString(message));
            log.debug("[Bus] SEND {} inst={} cid={}", message.type(), message.instanceId(), message.correlationId());
            return true;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise command " + message.type(), e);
        } catch (AmqpException e) {
            log.warn("[Bus] SEND {} inst={} failed, job loops will catch up: {}",
                    message.type(), message.instanceId(), e.getMessage());
            return false;
        }
    }
}
