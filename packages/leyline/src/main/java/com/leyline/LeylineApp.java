package com.leyline;

public class LeylineApp {

  private static final org.slf4j.Logger log =
      com.leyline.logging.LoggingService.getLogger(LeylineApp.class);

  public static void main(String[] args) {
    int exitCode;
    try (Leyline app = new Leyline(args)) {
      exitCode = app.run();
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.print(Leyline.USAGE);
      exitCode = 2;
    } catch (Exception e) {
      log.error("Leyline failed", e);
      exitCode = 1;
    }
    if (exitCode != 0) {
      System.exit(exitCode);
    }
  }
}
