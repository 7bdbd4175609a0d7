package udplower.ui;

/**
 * Data-Class to hold tool options.
 */
public class UdpLowerConfig {

  /** Name of the variable that packs all inputs of a primitive. */
  public String ifield_var_name = "tableline__ifield__udptmp";

  public boolean check_tree = true;
  public boolean dump_tree = false;

  /** Errors beyond this count are collected but not printed; 0 prints all. */
  public int max_errors = 0;
}
