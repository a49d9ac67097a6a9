package com.flamingo.reporttable.service.contact;

/**
 * Owner of an assignment group.
 *
 * @param name contact name
 * @param email contact e-mail address
 */
public record Contact(String name, String email) {}
