package com.quantori.eqp.core.configuration;

import lombok.Builder;
import lombok.Data;

@Builder
@Data
public class SystemConfigurationProperties {
  String systemName;
}
