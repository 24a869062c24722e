package com.teamflow.core.epic;

import com.teamflow.core.error.InvalidTransitionException;
import com.teamflow.core.error.NotFoundException;
import com.teamflow.core.error.VersionConflictException;
import com.teamflow.core.events.EventBus;
import com.teamflow.core.events.EventTypes;
import com.teamflow.core.events.TeamflowEvent;
import com.teamflow.core.logging.MdcContext;
import com.teamflow.core.metrics.TeamflowMetrics;
import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicState;
import com.teamflow.core.persistence.CoordinationRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owner of every epic. All epic mutations go through here.
 * <p>
 * Each epic has its own monitor. A transition checks the table in
 * {@link EpicState}, runs the hooks registered for the target state, then
 * commits the new state with {@code version + 1} in one step. Triggering event
 * ids are remembered per epic so a redelivered event is a no-op.
 */
@Service
public class EpicStateMachine {

    private static final Logger log = LoggerFactory.getLogger(EpicStateMachine.class);

    private static final int MAX_REMEMBERED_EVENTS = 1024;

    private final ConcurrentHashMap<String, Epic> epics = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Object> monitors = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Cache<String, Boolean>> seenEvents = new ConcurrentHashMap<>();
    private final Map<EpicState, List<TransitionHook>> hooks = new EnumMap<>(EpicState.class);

    private final CoordinationRepository repository;
    private final EventBus eventBus;
    private final TeamflowMetrics metrics;
    private final Clock clock;

    public EpicStateMachine(CoordinationRepository repository, EventBus eventBus, TeamflowMetrics metrics,
                            Clock clock, List<TransitionHook> transitionHooks) {
        this.repository = repository;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        for (TransitionHook hook : transitionHooks) {
            hooks.computeIfAbsent(hook.target(), k -> new ArrayList<>()).add(hook);
        }
    }

    public Epic create(String title, String description, List<String> objectives, List<String> constraints,
                       Integer externalRef) {
        Instant now = clock.instant();
        String id = "epic-" + now.toEpochMilli() + "-" + UUID.randomUUID().toString().substring(0, 8);
        var epic = new Epic(id, title, description, EpicState.UNINITIALIZED, objectives, constraints,
                externalRef, 0L, now, now);
        epics.put(id, epic);
        repository.saveEpic(epic);
        log.info("Created epic {} '{}'", id, title);
        return epic;
    }

    /** Looks the epic up in memory, then in the context store. */
    public Optional<Epic> find(String epicId) {
        Epic epic = epics.get(epicId);
        if (epic != null) {
            return Optional.of(epic);
        }
        return repository.loadEpic(epicId).map(loaded -> {
            Epic existing = epics.putIfAbsent(epicId, loaded);
            return existing != null ? existing : loaded;
        });
    }

    public Epic get(String epicId) {
        return find(epicId).orElseThrow(() -> new NotFoundException("Unknown epic: " + epicId));
    }

    /**
     * Epics filtered by state (null for any) and creation time (null for any), newest first.
     */
    public List<Epic> list(EpicState state, Instant createdAfter) {
        Map<String, Epic> all = new HashMap<>();
        for (String id : repository.epicIds()) {
            find(id).ifPresent(e -> all.put(id, e));
        }
        all.putAll(epics);
        return all.values().stream()
                .filter(e -> state == null || e.state() == state)
                .filter(e -> createdAfter == null || e.createdAt().isAfter(createdAfter))
                .sorted(Comparator.comparing(Epic::createdAt).reversed().thenComparing(Epic::id))
                .toList();
    }

    /**
     * Moves the epic to {@code target}.
     *
     * @param eventId id of the triggering event, or null; a repeated id returns the current epic unchanged
     * @throws InvalidTransitionException if the table does not allow the move; nothing is mutated
     */
    public Epic transition(String epicId, EpicState target, String eventId, String reason) {
        Epic current = get(epicId);
        synchronized (monitor(epicId)) {
            current = epics.getOrDefault(epicId, current);
            if (eventId != null && seen(epicId).getIfPresent(eventId) != null) {
                log.debug("Ignoring duplicate event {} for epic {}", eventId, epicId);
                return current;
            }
            EpicState from = current.state();
            if (!from.canTransitionTo(target)) {
                throw new InvalidTransitionException(epicId, from, target);
            }

            MdcContext.setEpic(epicId);
            try {
                for (TransitionHook hook : hooks.getOrDefault(target, List.of())) {
                    hook.onEnter(current, from, reason);
                }
                Epic committed = current.withState(target, clock.instant());
                repository.saveEpic(committed);
                epics.put(epicId, committed);
                if (eventId != null) {
                    remember(epicId, eventId);
                }
                metrics.recordEpicTransition(target.name().toLowerCase(Locale.ROOT));
                log.info("Epic {} {} -> {} (v{}){}", epicId, from, target, committed.version(),
                        reason == null ? "" : ": " + reason);
                eventBus.publish(TeamflowEvent.of(EventTypes.EPIC_TRANSITIONED, epicId, null,
                        Map.of("from", from.name(), "to", target.name(), "version", committed.version())));
                return committed;
            } finally {
                MdcContext.clear();
            }
        }
    }

    /**
     * Moves the epic only if it is currently in {@code expected}.
     *
     * @return the committed epic, or empty if it was in another state
     */
    public Optional<Epic> transitionIf(String epicId, EpicState expected, EpicState target, String reason) {
        synchronized (monitor(epicId)) {
            if (get(epicId).state() != expected) {
                return Optional.empty();
            }
            return Optional.of(transition(epicId, target, null, reason));
        }
    }

    /**
     * Updates title, description, objectives and constraints. Null arguments keep the current value.
     *
     * @param expectedVersion version the caller last saw, or null to skip the check
     * @throws VersionConflictException if {@code expectedVersion} is stale
     */
    public Epic update(String epicId, String title, String description, List<String> objectives,
                       List<String> constraints, Long expectedVersion) {
        Epic current = get(epicId);
        synchronized (monitor(epicId)) {
            current = epics.getOrDefault(epicId, current);
            if (expectedVersion != null && expectedVersion != current.version()) {
                throw new VersionConflictException("Epic " + epicId + " is at version " + current.version()
                        + ", expected " + expectedVersion);
            }
            Epic updated = current.withDetails(
                    title != null ? title : current.title(),
                    description != null ? description : current.description(),
                    objectives != null ? objectives : current.objectives(),
                    constraints != null ? constraints : current.constraints(),
                    clock.instant());
            repository.saveEpic(updated);
            epics.put(epicId, updated);
            log.info("Updated epic {} (v{})", epicId, updated.version());
            return updated;
        }
    }

    /**
     * Installs a restored epic. The stored version is kept unless the live one is already ahead.
     */
    public Epic restore(Epic restored) {
        synchronized (monitor(restored.id())) {
            Epic live = epics.get(restored.id());
            Epic result = live != null && live.version() > restored.version()
                    ? restored.withVersion(live.version())
                    : restored;
            epics.put(result.id(), result);
            repository.saveEpic(result);
            return result;
        }
    }

    public boolean acceptsAssignments(String epicId) {
        return get(epicId).state().acceptsAssignments();
    }

    private Object monitor(String epicId) {
        return monitors.computeIfAbsent(epicId, k -> new Object());
    }

    private Cache<String, Boolean> seen(String epicId) {
        return seenEvents.computeIfAbsent(epicId, k -> Caffeine.newBuilder()
                .maximumSize(MAX_REMEMBERED_EVENTS)
                .build());
    }

    private void remember(String epicId, String eventId) {
        seen(epicId).put(eventId, Boolean.TRUE);
    }
}
