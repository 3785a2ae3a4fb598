package com.ddpport.core.ddp;

/**
 * UI language the export was produced in; file names inside the archive depend on it.
 */
public enum Language {
    EN,
    NL
}
