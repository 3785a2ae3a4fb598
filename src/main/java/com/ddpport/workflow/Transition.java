package com.ddpport.workflow;

import java.util.List;

/**
 * Result of one {@link DonationWorkflow#start()} or {@link DonationWorkflow#advance(HostResponse)} call.
 *
 * @param state            state the workflow stopped in
 * @param platform         platform being processed, {@code null} once finished
 * @param commands         commands emitted, in order; the last one is the render command when awaiting a response
 * @param visited          every state entered during this call, in order
 * @param awaitingResponse whether the host must answer the last render command
 */
public record Transition(WorkflowState state,
                         String platform,
                         List<Command> commands,
                         List<WorkflowState> visited,
                         boolean awaitingResponse) {

    public Transition {
        commands = List.copyOf(commands);
        visited = List.copyOf(visited);
    }

    public <T extends Command> List<T> commandsOf(Class<T> type) {
        return commands.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
