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

/**
 * Queryable snapshot of product stock.
 */
public final class StockView {
    private final String productId;
    private final String productName;
    private final int onHand;
    private final int reserved;
    private final long version;

    public StockView(String productId, String productName, int onHand, int reserved, long version) {
        this.productId = productId;
        this.productName = productName;
        this.onHand = onHand;
        this.reserved = reserved;
        this.version = version;
    }

    StockView adjust(int onHandDelta, int reservedDelta, long newVersion) {
        return new StockView(productId, productName, onHand + onHandDelta, reserved + reservedDelta, newVersion);
    }

    public String getProductId() {
        return productId;
    }

    public String getProductName() {
        return productName;
    }

    public int getOnHand() {
        return onHand;
    }

    public int getReserved() {
        return reserved;
    }

    public int getAvailable() {
        return onHand - reserved;
    }

    /**
     * @return version of the stock stream last reflected in this view
     */
    public long getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "StockView[" + productId + " onHand=" + onHand + ", reserved=" + reserved + ", v" + version + "]";
    }
}
