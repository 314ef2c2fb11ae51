package com.beacon.notification.common.messaging;

import com.beacon.notification.common.model.ChannelType;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.Queue;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class QueueTopologyTest {

    @Test
    void testMainQueue_RoutesRejectedMessagesToDeadLetterExchange() {
        Queue queue = QueueTopology.mainQueue(QueueNames.EMAIL);

        assertTrue(queue.isDurable());
        assertEquals("email-notifications-dlx", queue.getArguments().get("x-dead-letter-exchange"));
        assertEquals("email-notifications", queue.getArguments().get("x-dead-letter-routing-key"));
    }

    @Test
    void testDeadLetterBinding_UsesQueueNameAsRoutingKey() {
        Binding binding = QueueTopology.deadLetterBinding(QueueNames.SMS);

        assertEquals("sms-notifications-dlq", binding.getDestination());
        assertEquals("sms-notifications-dlx", binding.getExchange());
        assertEquals("sms-notifications", binding.getRoutingKey());
    }

    @Test
    void testDeclare_DeclaresExchangeBothQueuesAndBinding() {
        AmqpAdmin admin = mock(AmqpAdmin.class);

        QueueTopology.declare(admin, QueueNames.PUSH);

        ArgumentCaptor<Queue> queues = ArgumentCaptor.forClass(Queue.class);
        verify(admin, times(2)).declareQueue(queues.capture());
        List<String> names = queues.getAllValues().stream().map(Queue::getName).toList();
        assertEquals(List.of("push-notifications-dlq", "push-notifications"), names);
        verify(admin).declareExchange(any());
        verify(admin).declareBinding(any());
    }

    @Test
    void testQueueNames_FollowChannelConvention() {
        assertEquals("push-notifications", QueueNames.forChannel(ChannelType.PUSH));
        assertEquals("bulk-notifications-dlq", QueueNames.deadLetterQueue(QueueNames.BULK));
        assertEquals("email-notifications", QueueNames.originalQueue("email-notifications-dlq"));
        assertThrows(IllegalArgumentException.class, () -> QueueNames.originalQueue("email-notifications"));
        assertEquals(4, QueueNames.deadLetterQueues().size());
    }
}
