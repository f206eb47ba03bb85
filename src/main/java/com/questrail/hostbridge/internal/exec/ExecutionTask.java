package com.questrail.hostbridge.internal.exec;

import com.questrail.hostbridge.command.Command;
import com.questrail.hostbridge.model.CommandResponse;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * ExecutionTask
 * -----------------------------------------------------------------------------
 * The unit of work handed to the {@link ExecutionSerializer}.
 *
 * <ul>
 *   <li>{@link Correlated}: TCP-originated. Carries a one-shot completion handle
 *       that the serializer writes exactly once. Readers only ever see a
 *       read-only {@link CompletionStage}.</li>
 *   <li>{@link FireAndForget}: UDP-originated. No handle; the outcome is
 *       observed only through observability.</li>
 * </ul>
 *
 * <p>If the reader of a correlated task goes away (timeout, disconnect) the
 * handle is simply never read again. The serializer still executes the command
 * and writes the outcome into the abandoned handle.</p>
 */
public sealed interface ExecutionTask
        permits ExecutionTask.Correlated, ExecutionTask.FireAndForget
{
    Command command();

    static Correlated correlated(Command command) {
        return new Correlated(command);
    }

    static FireAndForget fireAndForget(Command command) {
        return new FireAndForget(command);
    }

    /** A task whose outcome is awaited by exactly one caller. */
    final class Correlated implements ExecutionTask {
        private final Command command;
        private final CompletableFuture<CommandResponse> handle = new CompletableFuture<>();

        private Correlated(Command command) {
            this.command = Objects.requireNonNull(command, "command");
        }

        @Override
        public Command command() {
            return command;
        }

        /**
         * Read side of the completion handle.
         */
        public CompletionStage<CommandResponse> completion() {
            return handle.minimalCompletionStage();
        }

        public boolean isCompleted() {
            return handle.isDone();
        }

        /**
         * Write side; only the serializer calls this.
         *
         * @return {@code false} if an outcome had already been written
         */
        boolean complete(CommandResponse outcome) {
            return handle.complete(Objects.requireNonNull(outcome, "outcome"));
        }
    }

    /** A task nobody waits for. */
    final class FireAndForget implements ExecutionTask {
        private final Command command;

        private FireAndForget(Command command) {
            this.command = Objects.requireNonNull(command, "command");
        }

        @Override
        public Command command() {
            return command;
        }
    }
}
