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
 * Add received goods to stock on hand.
 */
public final class RestockProduct implements Command<Void> {
    private final String productId;
    private final int quantity;
    private final String idempotencyKey;

    public RestockProduct(String productId, int quantity) {
        this(productId, quantity, null);
    }

    public RestockProduct(String productId, int quantity, String idempotencyKey) {
        this.productId = Objects.requireNonNull(productId, "productId");
        this.quantity = quantity;
        this.idempotencyKey = idempotencyKey;
    }

    public String getProductId() {
        return productId;
    }

    public int getQuantity() {
        return quantity;
    }

    @Override
    public Optional<String> idempotencyKey() {
        return Optional.ofNullable(idempotencyKey);
    }

    @Override
    public String toString() {
        return "RestockProduct[" + productId + ", " + quantity + "]";
    }
}
