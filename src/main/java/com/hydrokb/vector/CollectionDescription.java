package com.hydrokb.vector;

public record CollectionDescription(String collection, int dimension) {
}
