package com.quantori.eqp.core.configuration;

import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.Behaviors;

public class LocalSystemProvider implements AkkaSystemProvider {

  @Override
  public ActorSystem<Void> actorTypedSystem(SystemConfigurationProperties properties) {
    return ActorSystem.create(Behaviors.empty(), getSystemNameOrDefault(properties.getSystemName()));
  }
}
