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

package dev.nishisan.mapserver.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class MapServerYamlConfig {

    @JsonProperty("submap_commands")
    private List<String> submapCommands;

    @JsonProperty("global_map_commands")
    private List<String> globalMapCommands;

    @JsonProperty("server")
    private ServerPolicyConfig server;

    public List<String> getSubmapCommands() {
        return submapCommands;
    }

    public void setSubmapCommands(List<String> submapCommands) {
        this.submapCommands = submapCommands;
    }

    public List<String> getGlobalMapCommands() {
        return globalMapCommands;
    }

    public void setGlobalMapCommands(List<String> globalMapCommands) {
        this.globalMapCommands = globalMapCommands;
    }

    public ServerPolicyConfig getServer() {
        return server;
    }

    public void setServer(ServerPolicyConfig server) {
        this.server = server;
    }
}
