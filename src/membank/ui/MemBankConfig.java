package membank.ui;

import java.io.InputStream;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Data-Class to hold tool options.
 */
public class MemBankConfig {

  /** Resource used for memories that do not name one */
  public String default_resource = "BRAM";

  public boolean check_bijection = true;
  public int max_reported_conflicts = 8;

  /** Print at most this many addresses in bank tables */
  public int max_table_addresses = 256;

  /** Name prefix of the address inputs in generated expressions */
  public String addr_prefix = "addr";

  /**
   * Loads a configuration from YAML. Keys not present keep their default values.
   * @param in the YAML document, a mapping of option names to values
   * @return the loaded configuration
   */
  public static MemBankConfig load(InputStream in) {
    Yaml yaml = new Yaml(new Constructor(MemBankConfig.class, new LoaderOptions()));
    MemBankConfig cfg = yaml.load(in);
    return cfg != null ? cfg : new MemBankConfig();
  }
}
