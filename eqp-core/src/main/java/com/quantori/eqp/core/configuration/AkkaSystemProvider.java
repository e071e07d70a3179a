package com.quantori.eqp.core.configuration;

import akka.actor.typed.ActorSystem;
import org.apache.commons.lang3.StringUtils;

public interface AkkaSystemProvider {
  String EQP_AKKA_SYSTEM = "eqp-akka-system";

  ActorSystem<Void> actorTypedSystem(SystemConfigurationProperties properties);

  default String getSystemNameOrDefault(String systemName) {
    if (StringUtils.isNotEmpty(systemName)) {
      return systemName;
    } else {
      return EQP_AKKA_SYSTEM;
    }
  }
}
