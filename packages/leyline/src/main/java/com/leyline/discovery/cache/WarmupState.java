package com.leyline.discovery.cache;

public enum WarmupState {
  COLD,
  WARMING,
  WARM
}
