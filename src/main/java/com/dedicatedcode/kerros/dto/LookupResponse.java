/*
 *  This file is part of kerros.
 *
 *  Kerros is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Kerros is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Kerros. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.kerros.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public class LookupResponse {

    @JsonProperty("engine")
    private String engine;

    @JsonProperty("lookup_status")
    private String lookupStatus;

    @JsonProperty("summary_text")
    private String summaryText;

    @JsonProperty("iso_context")
    private IsoContext isoContext;

    @JsonProperty("result")
    private Result result;

    @JsonProperty("dataset")
    private DatasetInfo dataset;

    @JsonProperty("version")
    private String version;

    public LookupResponse() {}

    public String getEngine() { return engine; }
    public void setEngine(String engine) { this.engine = engine; }

    public String getLookupStatus() { return lookupStatus; }
    public void setLookupStatus(String lookupStatus) { this.lookupStatus = lookupStatus; }

    public String getSummaryText() { return summaryText; }
    public void setSummaryText(String summaryText) { this.summaryText = summaryText; }

    public IsoContext getIsoContext() { return isoContext; }
    public void setIsoContext(IsoContext isoContext) { this.isoContext = isoContext; }

    public Result getResult() { return result; }
    public void setResult(Result result) { this.result = result; }

    public DatasetInfo getDataset() { return dataset; }
    public void setDataset(DatasetInfo dataset) { this.dataset = dataset; }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public static class HierarchyItem {
        @JsonProperty("level")
        private int level;

        @JsonProperty("name")
        private String name;

        @JsonProperty("osm_id")
        private String osmId;

        @JsonProperty("rank")
        private int rank;

        @JsonProperty("source")
        private String source;

        public HierarchyItem() {}

        public HierarchyItem(int level, String name, String osmId, int rank, String source) {
            this.level = level;
            this.name = name;
            this.osmId = osmId;
            this.rank = rank;
            this.source = source;
        }

        public int getLevel() { return level; }
        public void setLevel(int level) { this.level = level; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getOsmId() { return osmId; }
        public void setOsmId(String osmId) { this.osmId = osmId; }

        public int getRank() { return rank; }
        public void setRank(int rank) { this.rank = rank; }

        public String getSource() { return source; }
        public void setSource(String source) { this.source = source; }
    }

    public static class Result {
        @JsonProperty("admin_hierarchy")
        private List<HierarchyItem> adminHierarchy;

        @JsonProperty("missing_levels")
        private List<Integer> missingLevels;

        @JsonProperty("semantic_overlays")
        private Map<String, Map<String, Object>> semanticOverlays;

        public Result() {}

        public Result(List<HierarchyItem> adminHierarchy, List<Integer> missingLevels, Map<String, Map<String, Object>> semanticOverlays) {
            this.adminHierarchy = adminHierarchy;
            this.missingLevels = missingLevels;
            this.semanticOverlays = semanticOverlays;
        }

        public List<HierarchyItem> getAdminHierarchy() { return adminHierarchy; }
        public void setAdminHierarchy(List<HierarchyItem> adminHierarchy) { this.adminHierarchy = adminHierarchy; }

        public List<Integer> getMissingLevels() { return missingLevels; }
        public void setMissingLevels(List<Integer> missingLevels) { this.missingLevels = missingLevels; }

        public Map<String, Map<String, Object>> getSemanticOverlays() { return semanticOverlays; }
        public void setSemanticOverlays(Map<String, Map<String, Object>> semanticOverlays) { this.semanticOverlays = semanticOverlays; }
    }

    public static class IsoContext {
        @JsonProperty("iso2")
        private String iso2;

        @JsonProperty("name")
        private String name;

        public IsoContext() {}

        public IsoContext(String iso2, String name) {
            this.iso2 = iso2;
            this.name = name;
        }

        public String getIso2() { return iso2; }
        public void setIso2(String iso2) { this.iso2 = iso2; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
    }

    public static class DatasetInfo {
        @JsonProperty("id")
        private String id;

        @JsonProperty("version")
        private String version;

        public DatasetInfo() {}

        public DatasetInfo(String id, String version) {
            this.id = id;
            this.version = version;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }
    }
}
