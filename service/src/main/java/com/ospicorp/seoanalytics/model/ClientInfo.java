package com.ospicorp.seoanalytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClientInfo(long id, String name, String domain, String industry) {}
