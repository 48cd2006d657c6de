package com.example.stlabels.service.store;

import com.example.stlabels.model.Actor;

import java.util.Optional;

/**
 * Справочник пользователей: отображаемое имя по идентификатору.
 */
public interface ActorDirectory {

    Optional<Actor> findById(String actorId);

    void register(Actor actor);
}
