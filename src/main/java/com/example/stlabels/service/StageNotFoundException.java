package com.example.stlabels.service;

/**
 * Этап не найден в хранилище.
 */
public class StageNotFoundException extends RuntimeException {

    public StageNotFoundException(String stageId) {
        super("Stage not found: " + stageId);
    }
}
