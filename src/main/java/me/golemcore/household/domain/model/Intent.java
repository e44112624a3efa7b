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

package me.golemcore.household.domain.model;

/**
 * Query shapes the assistant remembers between turns.
 */
public enum Intent {

    BALANCE_QUERY("balance_query"),
    BALANCE_DETAILS("balance_details"),
    CHARITABLE_SUMMARY("charitable_summary"),
    CHARITABLE_DETAILS("charitable_details"),
    DUAL_SUMMARY("dual_summary"),
    ARITHMETIC("arithmetic");

    private final String key;

    Intent(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
