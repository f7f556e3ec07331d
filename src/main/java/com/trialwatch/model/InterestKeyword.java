package com.trialwatch.model;

import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * A weighted keyword for interest scoring, configured per topic.
 */
public record InterestKeyword(String keyword, @DefaultValue("5") int weight) {}
