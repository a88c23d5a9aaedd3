package com.example.permchange.service;

@FunctionalInterface
public interface PermissionChangeListener {

    void onChange(PermissionChangeEvent event);
}
