package com.autograder.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.DispatcherSelector;
import akka.actor.typed.SupervisorStrategy;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.autograder.services.SubmissionProcessor;
import com.autograder.utils.ProcessingEvents;
import com.autograder.utils.ProcessingEvents.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Owns the queue of submissions waiting for processing and a fixed pool of workers.
 * A submission is handed to a worker only when that worker is idle, so at most
 * {@code poolSize} submissions are processed at once and the queue absorbs the rest.
 */
public class TaskDispatcherActor extends AbstractBehavior<ProcessingMessages.Message> {
    private static final Logger logger = LoggerFactory.getLogger(TaskDispatcherActor.class);

    public static final String BLOCKING_DISPATCHER = "autograder.blocking-dispatcher";

    private final int poolSize;
    private final Deque<String> pending = new ArrayDeque<>();
    private final Deque<ActorRef<ProcessingMessages.Message>> idleWorkers = new ArrayDeque<>();
    private final Set<ActorRef<ProcessingMessages.Message>> busyWorkers = new HashSet<>();
    private long completed;

    private TaskDispatcherActor(ActorContext<ProcessingMessages.Message> context, SubmissionProcessor processor,
                                int poolSize, DispatcherSelector workerDispatcher) {
        super(context);
        this.poolSize = poolSize;
        for (int i = 0; i < poolSize; i++) {
            Behavior<ProcessingMessages.Message> worker = Behaviors.supervise(SubmissionWorkerActor.create(processor))
                    .onFailure(SupervisorStrategy.restart());
            idleWorkers.add(context.spawn(worker, "submission-worker-" + i, workerDispatcher));
        }
        logger.info("🏭 Task dispatcher started with {} workers", poolSize);
    }

    public static Behavior<ProcessingMessages.Message> create(SubmissionProcessor processor, int poolSize) {
        return create(processor, poolSize, DispatcherSelector.fromConfig(BLOCKING_DISPATCHER));
    }

    public static Behavior<ProcessingMessages.Message> create(SubmissionProcessor processor, int poolSize,
                                                              DispatcherSelector workerDispatcher) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be at least 1");
        }
        return Behaviors.setup(context -> new TaskDispatcherActor(context, processor, poolSize, workerDispatcher));
    }

    @Override
    public Receive<ProcessingMessages.Message> createReceive() {
        return newReceiveBuilder()
                .onMessage(ProcessingMessages.EnqueueSubmission.class, this::onEnqueueSubmission)
                .onMessage(ProcessingMessages.SubmissionFinished.class, this::onSubmissionFinished)
                .onMessage(ProcessingMessages.GetDispatcherStats.class, this::onGetDispatcherStats)
                .build();
    }

    private Behavior<ProcessingMessages.Message> onEnqueueSubmission(ProcessingMessages.EnqueueSubmission msg) {
        pending.addLast(msg.getSubmissionId());
        ProcessingEvents.info(msg.getSubmissionId(), Stage.DISPATCH, "queued depth=" + pending.size());
        dispatchPending();
        return this;
    }

    private Behavior<ProcessingMessages.Message> onSubmissionFinished(ProcessingMessages.SubmissionFinished msg) {
        if (busyWorkers.remove(msg.getWorker())) {
            idleWorkers.addLast(msg.getWorker());
        } else {
            logger.warn("Completion from unknown worker {} for submission {}", msg.getWorker(), msg.getSubmissionId());
        }
        completed++;
        logger.debug("Submission {} finished with outcome {}", msg.getSubmissionId(), msg.getOutcome());
        dispatchPending();
        return this;
    }

    private Behavior<ProcessingMessages.Message> onGetDispatcherStats(ProcessingMessages.GetDispatcherStats msg) {
        msg.getReplyTo().tell(new ProcessingMessages.DispatcherStats(
                pending.size(), busyWorkers.size(), idleWorkers.size(), poolSize, completed));
        return this;
    }

    private void dispatchPending() {
        while (!pending.isEmpty() && !idleWorkers.isEmpty()) {
            ActorRef<ProcessingMessages.Message> worker = idleWorkers.pollFirst();
            String submissionId = pending.pollFirst();
            busyWorkers.add(worker);
            worker.tell(new ProcessingMessages.ProcessSubmission(submissionId, getContext().getSelf()));
        }
    }
}
