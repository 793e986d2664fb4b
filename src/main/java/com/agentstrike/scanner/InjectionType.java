package com.agentstrike.scanner;

public enum InjectionType {
    URL_PARAM,
    BODY_PARAM,
    COOKIE,
    HEADER,
    JSON_PARAM,
    PATH
}
