package com.example.stlabels.model;

import lombok.Value;

/**
 * Пользователь, которому приписывается действие.
 * Идентификатор непрозрачен и принадлежит внешней системе идентификации.
 */
@Value
public class Actor {
    String id;
    String displayName;
}
