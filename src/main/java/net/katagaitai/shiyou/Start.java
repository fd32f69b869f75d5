package net.katagaitai.shiyou;

import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.shiyou.artifact.BuildOutputReader;
import net.katagaitai.shiyou.artifact.SolcContract;
import net.katagaitai.shiyou.decompile.EntryPointFailure;
import net.katagaitai.shiyou.evm.SymbolicExecutor;
import net.katagaitai.shiyou.spec.SpecPrinter;

import java.io.File;
import java.util.Iterator;
import java.util.Map;
import java.util.ServiceLoader;

@Slf4j(topic = "shiyou")
public class Start {

    public static void main(String[] args) {
        File input = null;
        String contractName = null;
        DecompilerOptions.DecompilerOptionsBuilder options = DecompilerOptions.builder();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--help")) {
                printHelp();
                System.exit(1);
            } else if (arg.equals("-input")) {
                if (i == args.length - 1) {
                    System.out.println("specify a path after -input.");
                    System.exit(1);
                } else {
                    input = new File(args[i + 1]);
                    i++;
                }
            } else if (arg.equals("-contract")) {
                if (i == args.length - 1) {
                    System.out.println("specify a contract name after -contract.");
                    System.exit(1);
                } else {
                    contractName = args[i + 1];
                    i++;
                }
            } else if (arg.equals("-timeout")) {
                if (i == args.length - 1 || !args[i + 1].matches("[0-9]+")) {
                    System.out.println("specify the solver timeout in milliseconds after -timeout.");
                    System.exit(1);
                } else {
                    options.solverTimeoutMills(Integer.parseInt(args[i + 1]));
                    i++;
                }
            } else if (arg.equals("-noverify")) {
                options.verify(false);
            }
        }

        if (input == null) {
            System.out.println("specify -input.");
            System.exit(1);
        }
        if (!input.canRead()) {
            System.out.println(input + " cannot be read. specify a correct path.");
            System.exit(1);
        }
        Iterator<SymbolicExecutor> executors = ServiceLoader.load(SymbolicExecutor.class).iterator();
        if (!executors.hasNext()) {
            System.out.println("no symbolic executor found on the classpath.");
            System.exit(1);
        }

        int status = 0;
        try {
            ImmutableMap<String, SolcContract> contracts = new BuildOutputReader().read(input.toPath());
            Decompiler decompiler = new Decompiler(executors.next(), options.build());
            for (Map.Entry<String, SolcContract> entry : contracts.entrySet()) {
                if (contractName != null && !entry.getKey().endsWith(contractName)) {
                    continue;
                }
                DecompileResult result = decompiler.decompile(entry.getValue());
                if (result.getSpecification() != null) {
                    System.out.println(SpecPrinter.print(result.getSpecification()));
                }
                for (EntryPointFailure failure : result.getFailures()) {
                    System.out.println(result.getContract() + ": " + failure.getEntryPoint() + ": "
                            + failure.getMessage());
                }
                if (result.getVerification() != null) {
                    System.out.println(result.getContract() + ": verification "
                            + (result.getVerification().isSuccess() ? "passed" : "failed"));
                }
                if (!result.isSuccess()) {
                    status = 1;
                }
            }
        } catch (Exception e) {
            log.error("", e);
            status = 1;
        }
        System.exit(status);
    }

    static void printHelp() {
        System.out.println("--help                -- print this message");
        System.out.println("-input <path>         -- solc --combined-json output or a foundry artifact.");
        System.out.println("-contract <name>      -- decompile only the named contract.");
        System.out.println("-timeout <millis>     -- timeout of each solver query.");
        System.out.println("-noverify             -- if specified, skip checking the specification against the bytecode.");
        System.out.println("e.g: cli -input out/combined.json -contract Store");
        System.out.println();
    }
}
