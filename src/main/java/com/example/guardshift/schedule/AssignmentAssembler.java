package com.example.guardshift.schedule;

import com.example.guardshift.exception.UnfillableSlotException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fills every slot of every post from the post's rotation queue.
 * <p>
 * Posts are processed in request order and the slots of each post in chronological order. For a
 * slot the queue is scanned from the head; the first eligible guard takes the slot and moves to the
 * tail of that post's queue. If no guard in the rotation is eligible the whole request fails with
 * {@link UnfillableSlotException}.
 * <p>
 * An assembler holds the queues and counters of a single request and can run only once.
 */
public class AssignmentAssembler {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentAssembler.class);

    public enum Phase {
        IDLE,
        GENERATING,
        ASSIGNING,
        SUCCEEDED,
        FAILED
    }

    private final ScheduleRequest request;
    private final TimeSlotGenerator slotGenerator;
    private final ConstraintChecker constraintChecker;
    private final Map<String, RotationQueue> queues = new LinkedHashMap<>();
    private final Map<String, GuardState> guardStates = new LinkedHashMap<>();
    private Phase phase = Phase.IDLE;

    public AssignmentAssembler(ScheduleRequest request) {
        this.request = request;
        this.slotGenerator = TimeSlotGenerator.forRequest(request);
        this.constraintChecker = ConstraintChecker.forRequest(request);
        for (PostSpec post : request.posts()) {
            queues.put(post.name(), new RotationQueue(request.guards()));
        }
        for (String guard : request.guards()) {
            guardStates.put(guard, new GuardState());
        }
    }

    public ScheduleResult assemble() {
        if (phase != Phase.IDLE) {
            throw new IllegalStateException("Assembler already used, phase=" + phase);
        }
        List<Assignment> assignments = new ArrayList<>();
        int skipped = 0;
        try {
            for (PostSpec post : request.posts()) {
                phase = Phase.GENERATING;
                RotationQueue queue = queues.get(post.name());
                for (ShiftSlot slot : slotGenerator.slotsFor(post.name())) {
                    if (!post.requiresCoverageAt(slot.start())) {
                        skipped++;
                        continue;
                    }
                    phase = Phase.ASSIGNING;
                    String guard = pickGuard(queue, slot);
                    assignments.add(Assignment.of(guard, slot));
                    queue.commit(guard);
                    guardStates.get(guard).record(slot);
                }
            }
        } catch (UnfillableSlotException e) {
            phase = Phase.FAILED;
            throw e;
        }
        phase = Phase.SUCCEEDED;
        return ScheduleResult.success(assignments, buildMetadata(assignments, skipped));
    }

    public Phase getPhase() {
        return phase;
    }

    /**
     * Current queue order of {@code post}, for diagnostics.
     */
    public List<String> queueOrder(String post) {
        RotationQueue queue = queues.get(post);
        return queue == null ? List.of() : queue.snapshot();
    }

    private String pickGuard(RotationQueue queue, ShiftSlot slot) {
        for (int offset = 0; offset < queue.size(); offset++) {
            String candidate = queue.peekFrom(offset);
            Optional<ConstraintChecker.Rejection> rejection =
                    constraintChecker.rejectionReason(candidate, slot, guardStates.get(candidate));
            if (rejection.isEmpty()) {
                return candidate;
            }
            logger.debug("{} rejected for {} {} - {}: {}", candidate, slot.post(), slot.start(), slot.end(),
                    rejection.get());
        }
        throw new UnfillableSlotException(slot.post(), slot.start(), slot.end());
    }

    private ScheduleMetadata buildMetadata(List<Assignment> assignments, int skipped) {
        Set<String> guards = new HashSet<>();
        Set<String> posts = new HashSet<>();
        for (Assignment a : assignments) {
            guards.add(a.guard());
            posts.add(a.post());
        }
        Map<String, GuardWorkload> workload = new LinkedHashMap<>();
        guardStates.forEach((guard, state) -> workload.put(guard, state.toWorkload()));
        double hours = request.horizon().toSeconds() / 3600.0;
        return new ScheduleMetadata(assignments.size(), guards.size(), posts.size(), hours, skipped, workload);
    }
}
