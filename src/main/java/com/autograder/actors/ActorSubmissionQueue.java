package com.autograder.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Scheduler;
import akka.actor.typed.javadsl.AskPattern;
import com.autograder.services.SubmissionQueue;

import java.time.Duration;
import java.util.concurrent.CompletionStage;

/**
 * {@link SubmissionQueue} that forwards submissions to a {@link TaskDispatcherActor}
 */
public class ActorSubmissionQueue implements SubmissionQueue {

    private final ActorRef<ProcessingMessages.Message> dispatcher;
    private final Scheduler scheduler;

    public ActorSubmissionQueue(ActorRef<ProcessingMessages.Message> dispatcher, Scheduler scheduler) {
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
    }

    @Override
    public void enqueue(String submissionId) {
        dispatcher.tell(new ProcessingMessages.EnqueueSubmission(submissionId));
    }

    public CompletionStage<ProcessingMessages.DispatcherStats> stats(Duration timeout) {
        return AskPattern.ask(dispatcher, ProcessingMessages.GetDispatcherStats::new, timeout, scheduler);
    }
}
