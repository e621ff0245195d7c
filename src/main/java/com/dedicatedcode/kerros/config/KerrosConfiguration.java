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

package com.dedicatedcode.kerros.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "kerros")
public class KerrosConfiguration {

    /**
     * Unpacked dataset directory loaded at startup and by reloads without an explicit directory.
     */
    private String dataDir = "./data";

    /**
     * Reported as {@code engine} in lookup responses and as {@code service} by the health check.
     */
    private String engineName = "kerros";

    private boolean verifyChecksums = true;

    private QueryConfiguration query = new QueryConfiguration();

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getEngineName() {
        return engineName;
    }

    public void setEngineName(String engineName) {
        this.engineName = engineName;
    }

    public boolean isVerifyChecksums() {
        return verifyChecksums;
    }

    public void setVerifyChecksums(boolean verifyChecksums) {
        this.verifyChecksums = verifyChecksums;
    }

    public QueryConfiguration getQuery() {
        return query;
    }

    public void setQuery(QueryConfiguration query) {
        this.query = query;
    }

    public static class QueryConfiguration {

        /**
         * Display language for datasets whose manifest does not name one, e.g. {@code en}.
         */
        private String defaultLanguage;

        public String getDefaultLanguage() {
            return defaultLanguage;
        }

        public void setDefaultLanguage(String defaultLanguage) {
            this.defaultLanguage = defaultLanguage == null || defaultLanguage.isBlank() ? null : defaultLanguage.trim();
        }
    }
}
