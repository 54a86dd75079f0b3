package com.fluxreader.common.model;

public record CategoryRef(long id, String title) {}
