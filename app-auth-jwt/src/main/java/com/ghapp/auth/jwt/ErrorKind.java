package com.ghapp.auth.jwt;

public enum ErrorKind {
    KEY_FILE_NOT_FOUND,
    INVALID_KEY_MATERIAL,
    UNKNOWN_INSTALLATION,
    EXCHANGE_FAILED,
    LIST_INSTALLATIONS_FAILED,
    COLLABORATOR_NOT_CONFIGURED
}
