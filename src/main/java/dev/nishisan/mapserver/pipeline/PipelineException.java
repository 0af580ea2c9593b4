/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.mapserver.pipeline;

/**
 * Raised when a pipeline stops at a failing command. The commands after
 * {@link #failedCommand()} were not executed.
 */
public final class PipelineException extends Exception {

    private final String pipelineName;
    private final String failedCommand;
    private final int failedIndex;

    public PipelineException(String pipelineName, String failedCommand, int failedIndex, Throwable cause) {
        super("Pipeline '" + pipelineName + "' aborted at command #" + failedIndex + " '" + failedCommand + "': "
                + (cause != null ? cause.getMessage() : "no result"), cause);
        this.pipelineName = pipelineName;
        this.failedCommand = failedCommand;
        this.failedIndex = failedIndex;
    }

    public String pipelineName() {
        return pipelineName;
    }

    public String failedCommand() {
        return failedCommand;
    }

    public int failedIndex() {
        return failedIndex;
    }
}
