package com.autograder.actors;

import akka.actor.typed.ActorRef;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Message types exchanged between the task dispatcher and its submission workers
 */
public class ProcessingMessages {

    // Base message interface
    public interface Message {
        // Marker interface for all processing messages
    }

    // Intake -> dispatcher
    public static class EnqueueSubmission implements Message {
        private final String submissionId;

        @JsonCreator
        public EnqueueSubmission(@JsonProperty("submissionId") String submissionId) {
            this.submissionId = submissionId;
        }

        public String getSubmissionId() { return submissionId; }
    }

    // Dispatcher -> worker
    public static class ProcessSubmission implements Message {
        private final String submissionId;
        private final ActorRef<Message> replyTo;

        @JsonCreator
        public ProcessSubmission(
                @JsonProperty("submissionId") String submissionId,
                @JsonProperty("replyTo") ActorRef<Message> replyTo) {
            this.submissionId = submissionId;
            this.replyTo = replyTo;
        }

        public String getSubmissionId() { return submissionId; }
        public ActorRef<Message> getReplyTo() { return replyTo; }
    }

    // Worker -> dispatcher, sent once per ProcessSubmission whatever happened
    public static class SubmissionFinished implements Message {
        private final String submissionId;
        private final ActorRef<Message> worker;
        private final String outcome;

        @JsonCreator
        public SubmissionFinished(
                @JsonProperty("submissionId") String submissionId,
                @JsonProperty("worker") ActorRef<Message> worker,
                @JsonProperty("outcome") String outcome) {
            this.submissionId = submissionId;
            this.worker = worker;
            this.outcome = outcome;
        }

        public String getSubmissionId() { return submissionId; }
        public ActorRef<Message> getWorker() { return worker; }
        public String getOutcome() { return outcome; }
    }

    // Monitoring
    public static class GetDispatcherStats implements Message {
        private final ActorRef<DispatcherStats> replyTo;

        @JsonCreator
        public GetDispatcherStats(@JsonProperty("replyTo") ActorRef<DispatcherStats> replyTo) {
            this.replyTo = replyTo;
        }

        public ActorRef<DispatcherStats> getReplyTo() { return replyTo; }
    }

    public static class DispatcherStats implements Message {
        private final int queued;
        private final int busy;
        private final int idle;
        private final int poolSize;
        private final long completed;

        @JsonCreator
        public DispatcherStats(
                @JsonProperty("queued") int queued,
                @JsonProperty("busy") int busy,
                @JsonProperty("idle") int idle,
                @JsonProperty("poolSize") int poolSize,
                @JsonProperty("completed") long completed) {
            this.queued = queued;
            this.busy = busy;
            this.idle = idle;
            this.poolSize = poolSize;
            this.completed = completed;
        }

        public int getQueued() { return queued; }
        public int getBusy() { return busy; }
        public int getIdle() { return idle; }
        public int getPoolSize() { return poolSize; }
        public long getCompleted() { return completed; }

        @Override
        public String toString() {
            return String.format("DispatcherStats{queued=%d, busy=%d, idle=%d, poolSize=%d, completed=%d}",
                    queued, busy, idle, poolSize, completed);
        }
    }
}
