package io.github.goodees.choreo.shop.inventory;

/*-
 * #%L
 * choreo
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.choreo.Command;

import java.util.Objects;
import java.util.Optional;

/**
 * Start tracking stock of a product.
 */
public final class InitializeStock implements Command<Void> {
    private final String productId;
    private final String productName;
    private final int initialQuantity;
    private final String idempotencyKey;

    public InitializeStock(String productId, String productName, int initialQuantity) {
        this(productId, productName, initialQuantity, null);
    }

    public InitializeStock(String productId, String productName, int initialQuantity, String idempotencyKey) {
        this.productId = Objects.requireNonNull(productId, "productId");
        this.productName = productName;
        this.initialQuantity = initialQuantity;
        this.idempotencyKey = idempotencyKey;
    }

    public String getProductId() {
        return productId;
    }

    public String getProductName() {
        return productName;
    }

    public int getInitialQuantity() {
        return initialQuantity;
    }

    @Override
    public Optional<String> idempotencyKey() {
        return Optional.ofNullable(idempotencyKey);
    }

    @Override
    public String toString() {
        return "InitializeStock[" + productId + ", " + productName + ", " + initialQuantity + "]";
    }
}
