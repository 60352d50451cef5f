package com.medbook.shared.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Outbox append service.
 *
 * Called from a domain service's transaction so that the event row commits or rolls back
 * together with the state change:
 * <pre>
 * {@literal @}Transactional
 * public Order cancel(...) {
 *     order.setStatus(CANCEL_PENDING);                      // domain write
 *     outboxService.publish(INVENTORY_CANCEL_ORDER, event); // event row, same tx
 * }
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxService {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    /**
     * Serialize {@code payload} and insert it as a PENDING outbox row.
     * Joins the caller's transaction; fails if there is none.
     *
     * @param eventType routing key (see EventTypes)
     * @param payload   event body, serialized to a JSON object
     * @return the persisted row
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent publish(String eventType, Object payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize outbox payload for " + eventType, e);
        }

        OutboxEvent event = outboxRepository.save(OutboxEvent.builder()
                .eventType(eventType)
                .payload(json)
                .status(OutboxStatus.PENDING)
                .build());

        log.debug("Outbox event appended: id={}, type={}", event.getId(), eventType);
        return event;
    }
}
