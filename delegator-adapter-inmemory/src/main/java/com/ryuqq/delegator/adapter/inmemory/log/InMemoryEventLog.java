package com.ryuqq.delegator.adapter.inmemory.log;

import com.ryuqq.delegator.core.event.Event;
import com.ryuqq.delegator.core.spi.EventLog;
import com.ryuqq.delegator.core.spi.LogRef;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory implementation of {@link EventLog} SPI for testing and reference purposes.
 *
 * <p>Events are kept in an {@link ArrayList} guarded by the instance monitor, so the
 * append order is the log order even under concurrent appends.</p>
 *
 * <p><strong>Characteristics:</strong></p>
 * <ul>
 *   <li><strong>append:</strong> O(1) amortized, returns 0-based sequential {@link LogRef}</li>
 *   <li><strong>read:</strong> O(N) immutable snapshot copy</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Unbounded growth (one log per task session)</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * EventLog log = new InMemoryEventLog();
 * log.append(TaskSubmitted.of(Task.of("add endpoint")));
 * Action next = controller.step(log);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryEventLog implements EventLog {

    private final List<Event> events;

    /**
     * Creates a new empty log.
     */
    public InMemoryEventLog() {
        this.events = new ArrayList<>();
    }

    /**
     * Creates a log pre-populated with the given events, in order.
     *
     * <p>Used to resume a session from a previously persisted history.</p>
     *
     * @param history events to replay into the log
     * @throws IllegalArgumentException if history is null or contains null
     */
    public InMemoryEventLog(List<? extends Event> history) {
        this();
        if (history == null) {
            throw new IllegalArgumentException("history cannot be null");
        }
        for (Event event : history) {
            append(event);
        }
    }

    @Override
    public synchronized LogRef append(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.add(event);
        return LogRef.of(events.size() - 1L);
    }

    @Override
    public synchronized List<Event> read() {
        return List.copyOf(events);
    }

    @Override
    public synchronized int size() {
        return events.size();
    }
}
