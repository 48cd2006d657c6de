package com.example.stlabels.service.store;

import com.example.stlabels.model.Actor;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class InMemoryActorDirectory implements ActorDirectory {
    private final Map<String, Actor> actors = new ConcurrentHashMap<>();

    @Override
    public Optional<Actor> findById(String actorId) {
        if (actorId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(actors.get(actorId));
    }

    @Override
    public void register(Actor actor) {
        actors.put(actor.getId(), actor);
    }
}
