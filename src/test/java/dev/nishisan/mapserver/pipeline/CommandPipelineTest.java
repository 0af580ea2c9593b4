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

import dev.nishisan.mapserver.engine.FakeMappingEngine;
import dev.nishisan.mapserver.engine.FakeMappingEngine.FakeGlobalMap;
import dev.nishisan.mapserver.engine.FakeMappingEngine.FakeSubmap;
import dev.nishisan.mapserver.engine.GlobalMap;
import dev.nishisan.mapserver.engine.MapCommand;
import dev.nishisan.mapserver.engine.MappingEngineException;
import dev.nishisan.mapserver.engine.Submap;
import dev.nishisan.mapserver.stats.MapServerMetrics;
import dev.nishisan.mapserver.stats.MapServerStats;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CommandPipelineTest {

    private final FakeMappingEngine engine = new FakeMappingEngine();
    private final MapServerStats stats = new MapServerStats();

    private static FakeSubmap submap() {
        return new FakeSubmap("alpha", Path.of("/maps/alpha-1"), FakeMappingEngine.DEFAULT_SPAN, List.of());
    }

    @Test
    void shouldRunCommandsInConfiguredOrder() throws PipelineException {
        CommandPipeline<Submap> pipeline = CommandPipeline.forSubmaps(List.of("optimize", "align", "optimize"),
                engine, stats);

        FakeSubmap result = (FakeSubmap) pipeline.run(submap());

        assertEquals(List.of("optimize", "align", "optimize"), result.appliedCommands());
        assertEquals(3, pipeline.size());
        assertEquals("submap", pipeline.name());
        assertTrue(stats.getAverage(MapServerMetrics.commandDuration("submap", "align")) >= 0);
    }

    @Test
    void emptyPipelineReturnsInput() throws PipelineException {
        CommandPipeline<Submap> pipeline = CommandPipeline.forSubmaps(List.of(), engine, stats);
        FakeSubmap input = submap();

        assertTrue(pipeline.isEmpty());
        assertSame(input, pipeline.run(input));
    }

    @Test
    void unknownCommandIsRejectedAtBuildTime() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CommandPipeline.forSubmaps(List.of("align", "teleport", "warp"), engine, stats));

        assertTrue(e.getMessage().contains("teleport"));
        assertTrue(e.getMessage().contains("warp"));
        assertThrows(IllegalArgumentException.class,
                () -> CommandPipeline.forGlobalMap(List.of("align"), engine, stats),
                "submap commands are not global commands");
    }

    @Test
    void blankCommandIsRejectedAtBuildTime() {
        assertThrows(IllegalArgumentException.class,
                () -> CommandPipeline.forGlobalMap(List.of("loop_close", " "), engine, stats));
    }

    @Test
    void shouldStopAtFirstFailingCommand() {
        List<String> executed = new ArrayList<>();
        Map<String, MapCommand<String>> commands = Map.of(
                "first", in -> {
                    executed.add("first");
                    return in + "1";
                },
                "broken", in -> {
                    executed.add("broken");
                    throw new MappingEngineException("broken", "bad input");
                },
                "last", in -> {
                    executed.add("last");
                    return in + "3";
                });
        CommandPipeline<String> pipeline = CommandPipeline.build("test", List.of("first", "broken", "last"),
                name -> Optional.ofNullable(commands.get(name)), stats);

        PipelineException e = assertThrows(PipelineException.class, () -> pipeline.run("x"));

        assertEquals(List.of("first", "broken"), executed);
        assertEquals("broken", e.failedCommand());
        assertEquals(1, e.failedIndex());
        assertEquals("test", e.pipelineName());
        assertInstanceOf(MappingEngineException.class, e.getCause());
        assertEquals(1, stats.getCounterValue(MapServerMetrics.commandFailure("test", "broken")));
    }

    @Test
    void nullResultCountsAsFailure() {
        CommandPipeline<String> pipeline = CommandPipeline.build("test", List.of("vanish"),
                name -> Optional.<MapCommand<String>>of(in -> null), stats);

        PipelineException e = assertThrows(PipelineException.class, () -> pipeline.run("x"));
        assertEquals("vanish", e.failedCommand());
    }

    @Test
    void runtimeFailureInsideCommandIsWrapped() {
        CommandPipeline<String> pipeline = CommandPipeline.build("test", List.of("npe"),
                name -> Optional.<MapCommand<String>>of(in -> {
                    throw new NullPointerException("engine bug");
                }), stats);

        PipelineException e = assertThrows(PipelineException.class, () -> pipeline.run("x"));
        assertInstanceOf(NullPointerException.class, e.getCause());
    }

    @Test
    void globalPipelineWorksOnTheGivenCopy() throws PipelineException {
        CommandPipeline<GlobalMap> pipeline = CommandPipeline.forGlobalMap(List.of("loop_close", "optimize"),
                engine, stats);
        GlobalMap original = engine.emptyMap();

        FakeGlobalMap result = (FakeGlobalMap) pipeline.run(original.copy());

        assertEquals(List.of("loop_close", "optimize"), result.appliedCommands());
        assertTrue(((FakeGlobalMap) original).appliedCommands().isEmpty());
    }
}
