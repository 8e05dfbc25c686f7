package com.toeic.recommender.exception;

import com.toeic.recommender.domain.DomainModels.ItemType;

public class InsufficientCatalogException extends RecommendationException {

    public InsufficientCatalogException(ItemType itemType) {
        super(itemType == null ? "Catalog is empty" : "Catalog has no items of type " + itemType);
    }

    @Override
    public String getCode() {
        return "INSUFFICIENT_CATALOG";
    }
}
