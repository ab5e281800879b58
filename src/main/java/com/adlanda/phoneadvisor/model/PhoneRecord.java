package com.adlanda.phoneadvisor.model;

/**
 * Snapshot of one catalog entry. Every field except {@code modelName} is free-form text
 * as published by the source, so numeric values must be parsed on demand.
 *
 * @param modelName   Unique model name, e.g. "Samsung Galaxy S24 Ultra"
 * @param releaseDate Release month/year text
 * @param display     Size, panel type and refresh rate
 * @param battery     Capacity and charging details
 * @param camera      Camera modules, main sensor first
 * @param ram         RAM options
 * @param storage     Storage options
 * @param price       Launch price, USD and/or EUR
 * @param chipset     SoC name
 * @param os          Launch OS and skin
 * @param body        Dimensions, weight and materials
 * @param url         Source page
 */
public record PhoneRecord(
        String modelName,
        String releaseDate,
        String display,
        String battery,
        String camera,
        String ram,
        String storage,
        String price,
        String chipset,
        String os,
        String body,
        String url
) {}
