package com.autograder.actors;

import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.autograder.models.ProcessingStatus;
import com.autograder.services.SubmissionProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Processes one submission at a time. Runs blocking adapter and store calls, so it is spawned on
 * the blocking dispatcher.
 */
public class SubmissionWorkerActor extends AbstractBehavior<ProcessingMessages.Message> {
    private static final Logger logger = LoggerFactory.getLogger(SubmissionWorkerActor.class);

    static final String SKIPPED = "skipped";

    private final SubmissionProcessor processor;

    private SubmissionWorkerActor(ActorContext<ProcessingMessages.Message> context, SubmissionProcessor processor) {
        super(context);
        this.processor = processor;
    }

    public static Behavior<ProcessingMessages.Message> create(SubmissionProcessor processor) {
        return Behaviors.setup(context -> new SubmissionWorkerActor(context, processor));
    }

    @Override
    public Receive<ProcessingMessages.Message> createReceive() {
        return newReceiveBuilder()
                .onMessage(ProcessingMessages.ProcessSubmission.class, this::onProcessSubmission)
                .build();
    }

    private Behavior<ProcessingMessages.Message> onProcessSubmission(ProcessingMessages.ProcessSubmission msg) {
        String outcome = SKIPPED;
        try {
            Optional<ProcessingStatus> status = processor.processQueued(msg.getSubmissionId());
            if (status.isPresent()) {
                outcome = status.get().getValue();
            }
        } catch (RuntimeException e) {
            logger.error("Worker {} failed on submission {}", getContext().getSelf().path().name(),
                    msg.getSubmissionId(), e);
            outcome = ProcessingStatus.FAILED.getValue();
        } finally {
            msg.getReplyTo().tell(new ProcessingMessages.SubmissionFinished(
                    msg.getSubmissionId(), getContext().getSelf(), outcome));
        }
        return this;
    }
}
