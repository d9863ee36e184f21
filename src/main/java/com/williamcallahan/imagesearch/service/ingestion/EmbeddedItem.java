package com.williamcallahan.imagesearch.service.ingestion;

record EmbeddedItem(HashedItem item, float[] vector) {

    @Override
    public String toString() {
        return item.toString();
    }
}
