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

import dev.nishisan.mapserver.engine.GlobalMap;
import dev.nishisan.mapserver.engine.MapCommand;
import dev.nishisan.mapserver.engine.MappingEngine;
import dev.nishisan.mapserver.engine.Submap;
import dev.nishisan.mapserver.stats.MapServerMetrics;
import dev.nishisan.mapserver.stats.MapServerStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * An ordered, immutable table of named commands, resolved once at startup.
 * <p>
 * {@link #run(Object)} threads a working value through every command in order
 * and stops at the first failure. Unknown command names are rejected when the
 * pipeline is built, never discovered mid-run.
 *
 * @param <T> the value the commands operate on
 */
public final class CommandPipeline<T> {

    private static final Logger LOGGER = Logger.getLogger(CommandPipeline.class.getName());

    private final String name;
    private final List<Step<T>> steps;
    private final MapServerStats stats;

    private CommandPipeline(String name, List<Step<T>> steps, MapServerStats stats) {
        this.name = name;
        this.steps = Collections.unmodifiableList(steps);
        this.stats = stats;
    }

    /**
     * Builds the submap pipeline from the configured command names.
     *
     * @throws IllegalArgumentException if the engine does not know one of the names
     */
    public static CommandPipeline<Submap> forSubmaps(List<String> commandNames, MappingEngine engine,
            MapServerStats stats) {
        Objects.requireNonNull(engine, "engine");
        return build("submap", commandNames, engine::submapCommand, stats);
    }

    /**
     * Builds the global map pipeline from the configured command names.
     *
     * @throws IllegalArgumentException if the engine does not know one of the names
     */
    public static CommandPipeline<GlobalMap> forGlobalMap(List<String> commandNames, MappingEngine engine,
            MapServerStats stats) {
        Objects.requireNonNull(engine, "engine");
        return build("global_map", commandNames, engine::globalMapCommand, stats);
    }

    static <T> CommandPipeline<T> build(String pipelineName, List<String> commandNames,
            Function<String, Optional<MapCommand<T>>> resolver, MapServerStats stats) {
        Objects.requireNonNull(commandNames, "commandNames");
        List<Step<T>> steps = new ArrayList<>(commandNames.size());
        List<String> unknown = new ArrayList<>();
        for (String commandName : commandNames) {
            if (commandName == null || commandName.isBlank()) {
                throw new IllegalArgumentException("Blank command name in " + pipelineName + " pipeline");
            }
            Optional<MapCommand<T>> command = resolver.apply(commandName);
            if (command.isPresent()) {
                steps.add(new Step<>(commandName, command.get()));
            } else {
                unknown.add(commandName);
            }
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown " + pipelineName + " command(s): " + unknown);
        }
        return new CommandPipeline<>(pipelineName, steps, stats);
    }

    /**
     * Runs every command in order on the given working value.
     *
     * @param input the working value, owned by the caller
     * @return the value produced by the last command, or {@code input} if the
     *         pipeline is empty
     * @throws PipelineException at the first command that throws or returns {@code null}
     */
    public T run(T input) throws PipelineException {
        T current = Objects.requireNonNull(input, "input");
        for (int i = 0; i < steps.size(); i++) {
            Step<T> step = steps.get(i);
            long start = System.nanoTime();
            T next;
            try {
                next = step.command().apply(current);
            } catch (Exception e) {
                notifyFailure(step);
                throw new PipelineException(name, step.name(), i, e);
            }
            if (next == null) {
                notifyFailure(step);
                throw new PipelineException(name, step.name(), i, null);
            }
            long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
            if (stats != null) {
                stats.notifyAverageCounter(MapServerMetrics.commandDuration(name, step.name()), elapsedMs);
            }
            int position = i + 1;
            LOGGER.fine(() -> "[" + name + "] command '" + step.name() + "' (" + position + "/" + steps.size()
                    + ") finished in " + elapsedMs + "ms");
            current = next;
        }
        return current;
    }

    private void notifyFailure(Step<T> step) {
        if (stats != null) {
            stats.notifyHitCounter(MapServerMetrics.commandFailure(name, step.name()));
        }
    }

    public String name() {
        return name;
    }

    /** The command names in execution order. */
    public List<String> commandNames() {
        List<String> names = new ArrayList<>(steps.size());
        steps.forEach(s -> names.add(s.name()));
        return Collections.unmodifiableList(names);
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int size() {
        return steps.size();
    }

    private record Step<T>(String name, MapCommand<T> command) {
    }
}
