package com.demo.degree.model;

public record OrganizationProfile(
        String name,
        String country,      // optional
        String contactEmail  // optional
) {}
