package com.vuong.pgconnect.support;

public class NotAnEntity {

    private Long id;

    public Long getId() {
        return id;
    }
}
