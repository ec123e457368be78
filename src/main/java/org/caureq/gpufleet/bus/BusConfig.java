package org.caureq.gpufleet.bus;

import org.caureq.gpufleet.config.AppProps;
import org.springframework.amqp.core.AnonymousQueue;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.FanoutExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pub/sub topology: a fanout exchange named after the channel and one
 * auto-delete queue per process. Messages published while no process is
 * subscribed are lost; the job loops pick the work up from the ledger.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.bus", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BusConfig {

    @Bean
    public FanoutExchange commandExchange(AppProps props) {
        return new FanoutExchange(props.bus().channel(), true, false);
    }

    @Bean
    public Queue commandQueue() {
        return new AnonymousQueue();
    }

    @Bean
    public Binding commandBinding(Queue commandQueue, FanoutExchange commandExchange) {
        return BindingBuilder.bind(commandQueue).to(commandExchange);
    }
}
