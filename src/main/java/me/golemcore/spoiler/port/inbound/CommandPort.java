/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.spoiler.port.inbound;

import java.util.List;

/**
 * Port for executing administrative slash commands (/add_keyword,
 * /enable_chat, etc.). Commands bypass the message pipeline and operate on the
 * keyword configuration directly.
 */
public interface CommandPort {

    /**
     * Executes a command invocation.
     *
     * @param invocation
     *            command name, argument tokens and the invoking chat/user
     * @return command execution result with success status and reply text
     */
    CommandResult execute(CommandInvocation invocation);

    /**
     * Checks if a command with the given name is registered.
     */
    boolean hasCommand(String command);

    /**
     * Returns a list of all available commands with their definitions.
     */
    List<CommandDefinition> listCommands();

    /**
     * A single command call as delivered by a channel.
     *
     * @param command
     *            command name without leading slash or bot mention
     * @param args
     *            whitespace-separated argument tokens
     * @param chatId
     *            chat the command was sent in
     * @param userId
     *            user who sent the command
     */
    record CommandInvocation(
            String command,
            List<String> args,
            long chatId,
            long userId
    ) {
        public CommandInvocation {
            args = args != null ? List.copyOf(args) : List.of();
        }
    }

    /**
     * Represents the result of a command execution including success status and output message.
     */
    record CommandResult(
            boolean success,
            String output
    ) {
        /**
         * Creates a successful command result.
         */
        public static CommandResult success(String output) {
            return new CommandResult(true, output);
        }

        /**
         * Creates a failed command result with error message.
         */
        public static CommandResult failure(String error) {
            return new CommandResult(false, error);
        }
    }

    /**
     * Defines a command's metadata including name, description, and usage examples.
     */
    record CommandDefinition(
            String name,
            String description,
            String usage,
            boolean adminOnly
    ) {}
}
