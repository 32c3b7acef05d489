package me.golemcore.council.domain.runtime;

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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link PricingCatalog} backed by a provider → model → price table. Provider
 * names match case-insensitively; model names match exactly first, then in
 * lower case.
 */
public class MapPricingCatalog implements PricingCatalog {

    private final Map<String, Map<String, ModelPrice>> prices = new HashMap<>();

    public MapPricingCatalog(Map<String, Map<String, ModelPrice>> table) {
        table.forEach((provider, models) -> {
            Map<String, ModelPrice> byModel = prices.computeIfAbsent(normalize(provider), k -> new HashMap<>());
            byModel.putAll(models);
        });
    }

    public static MapPricingCatalog empty() {
        return new MapPricingCatalog(Map.of());
    }

    @Override
    public Optional<ModelPrice> findPrice(String provider, String model) {
        if (provider == null || model == null) {
            return Optional.empty();
        }
        Map<String, ModelPrice> byModel = prices.get(normalize(provider));
        if (byModel == null) {
            return Optional.empty();
        }
        ModelPrice price = byModel.get(model);
        if (price == null) {
            price = byModel.get(model.toLowerCase(Locale.ROOT));
        }
        return Optional.ofNullable(price);
    }

    private static String normalize(String provider) {
        return provider.toLowerCase(Locale.ROOT);
    }
}
