package com.mk.fx.qa.load.traffic.rest;

public enum HttpMethod {
    GET,
    POST
}
