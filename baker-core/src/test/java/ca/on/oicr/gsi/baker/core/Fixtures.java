package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.FilePattern;
import ca.on.oicr.gsi.baker.Resolution;
import ca.on.oicr.gsi.baker.ResolutionError;
import ca.on.oicr.gsi.baker.Secrets;
import ca.on.oicr.gsi.baker.XarrayZarrRecipe;
import ca.on.oicr.gsi.baker.api.Bakery;
import ca.on.oicr.gsi.baker.api.Cluster;
import ca.on.oicr.gsi.baker.api.FargateClusterOptions;
import ca.on.oicr.gsi.baker.api.RecipeBakery;
import ca.on.oicr.gsi.baker.api.RecipeEntry;
import ca.on.oicr.gsi.baker.api.RecipeManifest;
import ca.on.oicr.gsi.baker.api.StorageOptions;
import ca.on.oicr.gsi.baker.api.TargetDescriptor;
import ca.on.oicr.gsi.baker.api.TargetProtocol;
import ca.on.oicr.gsi.baker.api.Versions;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class Fixtures {
  static final String BAKERY_ID = "devseed.bakery.development.aws.us-west-2";
  static final String NOTEBOOK = "2021.07.17";
  static final String FRAMEWORK = "0.5.0";
  static final String ENGINE = "0.14.7";
  static final String TARGET = "pangeo-forge-us-west-2";

  static Bakery bakery(Cluster cluster) {
    final var bakery = new Bakery();
    bakery.setRegion("us-west-2");
    bakery.setCluster(cluster);
    bakery.setTargets(
        Map.of(
            TARGET,
            new TargetDescriptor(
                new TargetProtocol("s3", new StorageOptions("AWS_KEY", "AWS_SECRET")))));
    return bakery;
  }

  static Cluster aksCluster() {
    final var cluster = new Cluster();
    cluster.setType("azure.aks");
    cluster.setWorkerImage("pangeo/pangeo-forge-bakery-images:pangeonotebook-2021.07.17");
    cluster.setFlowStorage("flow-container");
    cluster.setFlowStorageProtocol("abfs");
    cluster.setFlowStorageOptions(new StorageOptions(null, "AZURE_CONNECTION"));
    cluster.setMaxWorkers(10);
    cluster.setPangeoNotebookVersion(NOTEBOOK);
    cluster.setPangeoForgeVersion(FRAMEWORK);
    cluster.setPrefectVersion(ENGINE);
    return cluster;
  }

  static Cluster fargateCluster() {
    final var options = new FargateClusterOptions();
    options.setVpc("vpc-0123");
    options.setClusterArn("arn:aws:ecs:us-west-2:000000000000:cluster/bakery");
    options.setTaskRoleArn("arn:aws:iam::000000000000:role/task");
    options.setExecutionRoleArn("arn:aws:iam::000000000000:role/execution");
    options.setSecurityGroups(List.of("sg-0123"));
    final var cluster = new Cluster();
    cluster.setType("aws.fargate");
    cluster.setWorkerImage("pangeo/pangeo-forge-bakery-images:pangeonotebook-2021.07.17");
    cluster.setClusterOptions(options);
    cluster.setFlowStorage("flow-bucket");
    cluster.setFlowStorageProtocol("s3");
    cluster.setFlowStorageOptions(new StorageOptions("AWS_KEY", "AWS_SECRET"));
    cluster.setMaxWorkers(20);
    cluster.setPangeoNotebookVersion(NOTEBOOK);
    cluster.setPangeoForgeVersion(FRAMEWORK);
    cluster.setPrefectVersion(ENGINE);
    return cluster;
  }

  static String message(Resolution<?> resolution) {
    return resolution.apply(
        new Resolution.Visitor<Object, String>() {
          @Override
          public String failed(ResolutionError error, String message) {
            return message;
          }

          @Override
          public String resolved(Object value) {
            return "";
          }
        });
  }

  static RecipeManifest manifest(RecipeEntry... entries) {
    final var manifest = new RecipeManifest();
    manifest.setTitle("Test recipes");
    manifest.setPangeoNotebookVersion(NOTEBOOK);
    manifest.setPangeoForgeVersion(FRAMEWORK);
    manifest.setBakery(new RecipeBakery(BAKERY_ID, TARGET, null));
    manifest.setRecipes(List.of(entries));
    return manifest;
  }

  static XarrayZarrRecipe recipe(int inputs) {
    final var keys = new ArrayList<String>();
    for (var i = 0; i < inputs; i++) {
      keys.add(String.format("2020-%02d", i + 1));
    }
    return new XarrayZarrRecipe(
        new FilePattern("https://data.example.com/sst/{time}.nc", "time", keys));
  }

  static Versions runtime() {
    return new Versions(NOTEBOOK, FRAMEWORK, ENGINE);
  }

  static Secrets secrets() {
    return Secrets.of(
        Map.of(
            "AWS_KEY", "access-key",
            "AWS_SECRET", "secret-key",
            "AZURE_CONNECTION", "DefaultEndpointsProtocol=https;AccountName=bakery",
            "ACTIONS_BOT_TOKEN", "bot-token"));
  }

  private Fixtures() {}
}
