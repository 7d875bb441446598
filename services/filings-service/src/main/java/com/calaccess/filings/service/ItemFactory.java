package com.calaccess.filings.service;

@FunctionalInterface
public interface ItemFactory<P, D, T> {

    T create(P parentId, Integer lineItem, D fields);
}
