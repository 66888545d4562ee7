package io.hyperfoil.tools.seqdiag.parse;

import io.hyperfoil.tools.seqdiag.model.ParticipantType;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Infers a participant shape from its name with an ordered table of case-insensitive patterns. First match wins.
 * <p>
 * Infrastructure suffixes (Router, Scheduler, Handler...) are listed before the actor rules so that names ending in
 * -er or -or are not drawn as stick figures.
 */
public class ParticipantInference {

    public static class Rule {
        private final Pattern pattern;
        private final ParticipantType type;

        Rule(String pattern, ParticipantType type){
            this.pattern = Pattern.compile(pattern,Pattern.CASE_INSENSITIVE);
            this.type = type;
        }

        public boolean matches(String name){
            return pattern.matcher(name).find();
        }
        public Pattern getPattern(){return pattern;}
        public ParticipantType getType(){return type;}

        @Override
        public String toString(){
            return pattern.pattern() + " -> " + type;
        }
    }

    private static Rule rule(String pattern, ParticipantType type){
        return new Rule(pattern,type);
    }

    private static final List<Rule> RULES = List.of(
            // conflict overrides
            rule("^KeyDB$", ParticipantType.CACHE),
            rule("Webhook", ParticipantType.EXTERNAL),
            rule("^Upstream$", ParticipantType.EXTERNAL),
            rule("^Downstream$", ParticipantType.EXTERNAL),
            // infrastructure overrides
            rule("^.*Router$", ParticipantType.NETWORKING),
            rule("^.*Scheduler$", ParticipantType.SERVICE),
            rule("^.*Dispatcher$", ParticipantType.SERVICE),
            rule("^.*Balancer$", ParticipantType.NETWORKING),
            rule("^.*Controller$", ParticipantType.SERVICE),
            rule("^.*Handler$", ParticipantType.SERVICE),
            rule("^.*Processor$", ParticipantType.SERVICE),
            rule("^.*Connector$", ParticipantType.SERVICE),
            rule("^.*Adapter$", ParticipantType.SERVICE),
            rule("^.*Provider$", ParticipantType.SERVICE),
            rule("^.*Manager$", ParticipantType.SERVICE),
            rule("^.*Orchestrator$", ParticipantType.SERVICE),
            rule("^.*Monitor$", ParticipantType.SERVICE),
            rule("^.*Resolver$", ParticipantType.SERVICE),
            rule("^.*Logger$", ParticipantType.SERVICE),
            rule("^.*Server$", ParticipantType.SERVICE),
            rule("^.*Broker$", ParticipantType.QUEUE),
            rule("^.*Worker$", ParticipantType.SERVICE),
            rule("^.*Consumer$", ParticipantType.SERVICE),
            rule("^.*Producer$", ParticipantType.SERVICE),
            rule("^.*Publisher$", ParticipantType.SERVICE),
            rule("^.*Subscriber$", ParticipantType.SERVICE),
            rule("^.*Listener$", ParticipantType.SERVICE),
            rule("^.*Watcher$", ParticipantType.SERVICE),
            rule("^.*Executor$", ParticipantType.SERVICE),
            rule("^.*Aggregator$", ParticipantType.SERVICE),
            rule("^.*Collector$", ParticipantType.SERVICE),
            rule("^.*Transformer$", ParticipantType.SERVICE),
            rule("^.*Validator$", ParticipantType.SERVICE),
            rule("^.*Generator$", ParticipantType.SERVICE),
            rule("^.*Indexer$", ParticipantType.SERVICE),
            rule("^.*Crawler$", ParticipantType.SERVICE),
            rule("^.*Scanner$", ParticipantType.SERVICE),
            rule("^.*Parser$", ParticipantType.SERVICE),
            rule("^.*Emitter$", ParticipantType.SERVICE),
            rule("^.*Exporter$", ParticipantType.SERVICE),
            rule("^.*Importer$", ParticipantType.SERVICE),
            rule("^.*Loader$", ParticipantType.SERVICE),
            rule("^.*Renderer$", ParticipantType.SERVICE),
            rule("^.*Checker$", ParticipantType.SERVICE),
            rule("^.*Inspector$", ParticipantType.SERVICE),
            rule("^.*Encoder$", ParticipantType.SERVICE),
            rule("^.*Decoder$", ParticipantType.SERVICE),
            rule("^.*Notifier$", ParticipantType.SERVICE),
            // networking patterns
            rule("Gateway", ParticipantType.NETWORKING),
            rule("GW$", ParticipantType.NETWORKING),
            rule("Proxy", ParticipantType.NETWORKING),
            rule("LB$", ParticipantType.NETWORKING),
            rule("LoadBalancer", ParticipantType.NETWORKING),
            rule("CDN", ParticipantType.NETWORKING),
            rule("Firewall", ParticipantType.NETWORKING),
            rule("WAF$", ParticipantType.NETWORKING),
            rule("DNS", ParticipantType.NETWORKING),
            rule("Ingress", ParticipantType.NETWORKING),
            rule("Nginx", ParticipantType.NETWORKING),
            rule("Traefik", ParticipantType.NETWORKING),
            rule("Envoy", ParticipantType.NETWORKING),
            rule("Istio", ParticipantType.NETWORKING),
            rule("Kong", ParticipantType.NETWORKING),
            rule("Akamai", ParticipantType.NETWORKING),
            rule("Cloudflare", ParticipantType.NETWORKING),
            rule("Mesh$", ParticipantType.NETWORKING),
            rule("ServiceMesh", ParticipantType.NETWORKING),
            // database patterns
            rule("DB$", ParticipantType.DATABASE),
            rule("Database", ParticipantType.DATABASE),
            rule("Datastore", ParticipantType.DATABASE),
            rule("Store$", ParticipantType.DATABASE),
            rule("Storage", ParticipantType.DATABASE),
            rule("Repo$", ParticipantType.DATABASE),
            rule("Repository", ParticipantType.DATABASE),
            rule("SQL", ParticipantType.DATABASE),
            rule("Postgres", ParticipantType.DATABASE),
            rule("MySQL", ParticipantType.DATABASE),
            rule("Mongo", ParticipantType.DATABASE),
            rule("Dynamo", ParticipantType.DATABASE),
            rule("^Aurora$", ParticipantType.DATABASE),
            rule("Spanner", ParticipantType.DATABASE),
            rule("Supabase", ParticipantType.DATABASE),
            rule("Firebase", ParticipantType.DATABASE),
            rule("BigQuery", ParticipantType.DATABASE),
            rule("Redshift", ParticipantType.DATABASE),
            rule("Snowflake", ParticipantType.DATABASE),
            rule("Cassandra", ParticipantType.DATABASE),
            rule("Neo4j", ParticipantType.DATABASE),
            rule("ClickHouse", ParticipantType.DATABASE),
            rule("Elastic", ParticipantType.DATABASE),
            rule("OpenSearch", ParticipantType.DATABASE),
            rule("Druid", ParticipantType.DATABASE),
            rule("Trino", ParticipantType.DATABASE),
            rule("Pinecone", ParticipantType.DATABASE),
            rule("Weaviate", ParticipantType.DATABASE),
            rule("Qdrant", ParticipantType.DATABASE),
            rule("Milvus", ParticipantType.DATABASE),
            rule("Presto", ParticipantType.DATABASE),
            rule("Table$", ParticipantType.DATABASE),
            // cache patterns
            rule("Cache", ParticipantType.CACHE),
            rule("Redis", ParticipantType.CACHE),
            rule("Memcache", ParticipantType.CACHE),
            rule("Dragonfly", ParticipantType.CACHE),
            rule("Hazelcast", ParticipantType.CACHE),
            rule("Valkey", ParticipantType.CACHE),
            // queue/messaging patterns
            rule("Queue", ParticipantType.QUEUE),
            rule("MQ$", ParticipantType.QUEUE),
            rule("SQS", ParticipantType.QUEUE),
            rule("Kafka", ParticipantType.QUEUE),
            rule("RabbitMQ", ParticipantType.QUEUE),
            rule("EventBus", ParticipantType.QUEUE),
            rule("MessageBus", ParticipantType.QUEUE),
            rule("Bus$", ParticipantType.QUEUE),
            rule("Topic", ParticipantType.QUEUE),
            rule("Stream$", ParticipantType.QUEUE),
            rule("SNS", ParticipantType.QUEUE),
            rule("PubSub", ParticipantType.QUEUE),
            rule("NATS", ParticipantType.QUEUE),
            rule("Pulsar", ParticipantType.QUEUE),
            rule("Kinesis", ParticipantType.QUEUE),
            rule("EventBridge", ParticipantType.QUEUE),
            rule("CloudEvents", ParticipantType.QUEUE),
            rule("Celery", ParticipantType.QUEUE),
            rule("Sidekiq", ParticipantType.QUEUE),
            rule("EventHub", ParticipantType.QUEUE),
            rule("Channel$", ParticipantType.QUEUE),
            // actor patterns
            rule("^Admin$", ParticipantType.ACTOR),
            rule("^User$", ParticipantType.ACTOR),
            rule("^Customer$", ParticipantType.ACTOR),
            rule("^Client$", ParticipantType.ACTOR),
            rule("^Agent$", ParticipantType.ACTOR),
            rule("^Person$", ParticipantType.ACTOR),
            rule("^Buyer$", ParticipantType.ACTOR),
            rule("^Seller$", ParticipantType.ACTOR),
            rule("^Guest$", ParticipantType.ACTOR),
            rule("^Visitor$", ParticipantType.ACTOR),
            rule("^Operator$", ParticipantType.ACTOR),
            rule("^Alice$", ParticipantType.ACTOR),
            rule("^Bob$", ParticipantType.ACTOR),
            rule("^Charlie$", ParticipantType.ACTOR),
            rule("^Fan$", ParticipantType.ACTOR),
            rule("^Purchaser$", ParticipantType.ACTOR),
            rule("^Reviewer$", ParticipantType.ACTOR),
            rule("User$", ParticipantType.ACTOR),
            rule("Actor$", ParticipantType.ACTOR),
            rule("Analyst$", ParticipantType.ACTOR),
            // frontend patterns
            rule("App$", ParticipantType.FRONTEND),
            rule("Application", ParticipantType.FRONTEND),
            rule("Mobile", ParticipantType.FRONTEND),
            rule("iOS", ParticipantType.FRONTEND),
            rule("Android", ParticipantType.FRONTEND),
            rule("Web", ParticipantType.FRONTEND),
            rule("Browser", ParticipantType.FRONTEND),
            rule("Frontend", ParticipantType.FRONTEND),
            rule("UI$", ParticipantType.FRONTEND),
            rule("Dashboard", ParticipantType.FRONTEND),
            rule("CLI$", ParticipantType.FRONTEND),
            rule("Terminal", ParticipantType.FRONTEND),
            rule("React", ParticipantType.FRONTEND),
            rule("^Vue$", ParticipantType.FRONTEND),
            rule("Angular", ParticipantType.FRONTEND),
            rule("Svelte", ParticipantType.FRONTEND),
            rule("NextJS", ParticipantType.FRONTEND),
            rule("Nuxt", ParticipantType.FRONTEND),
            rule("Remix", ParticipantType.FRONTEND),
            rule("Electron", ParticipantType.FRONTEND),
            rule("Tauri", ParticipantType.FRONTEND),
            rule("Widget$", ParticipantType.FRONTEND),
            rule("Portal", ParticipantType.FRONTEND),
            rule("Console$", ParticipantType.FRONTEND),
            rule("^SPA$", ParticipantType.FRONTEND),
            rule("^PWA$", ParticipantType.FRONTEND),
            // service patterns
            rule("Service", ParticipantType.SERVICE),
            rule("Svc$", ParticipantType.SERVICE),
            rule("API$", ParticipantType.SERVICE),
            rule("Lambda", ParticipantType.SERVICE),
            rule("Function$", ParticipantType.SERVICE),
            rule("Fn$", ParticipantType.SERVICE),
            rule("Job$", ParticipantType.SERVICE),
            rule("Cron", ParticipantType.SERVICE),
            rule("Microservice", ParticipantType.SERVICE),
            rule("^Auth$", ParticipantType.SERVICE),
            rule("^AuthN$", ParticipantType.SERVICE),
            rule("^AuthZ$", ParticipantType.SERVICE),
            rule("^SSO$", ParticipantType.SERVICE),
            rule("OAuth", ParticipantType.SERVICE),
            rule("^OIDC$", ParticipantType.SERVICE),
            rule("Stripe", ParticipantType.SERVICE),
            rule("Twilio", ParticipantType.SERVICE),
            rule("SendGrid", ParticipantType.SERVICE),
            rule("Mailgun", ParticipantType.SERVICE),
            rule("^S3$", ParticipantType.SERVICE),
            rule("^Blob$", ParticipantType.SERVICE),
            rule("Vercel", ParticipantType.SERVICE),
            rule("Netlify", ParticipantType.SERVICE),
            rule("Heroku", ParticipantType.SERVICE),
            rule("Docker", ParticipantType.SERVICE),
            rule("Kubernetes", ParticipantType.SERVICE),
            rule("K8s", ParticipantType.SERVICE),
            rule("Terraform", ParticipantType.SERVICE),
            rule("Vault", ParticipantType.SERVICE),
            rule("^HSM$", ParticipantType.SERVICE),
            rule("KMS", ParticipantType.SERVICE),
            rule("^IAM$", ParticipantType.SERVICE),
            rule("^LLM$", ParticipantType.SERVICE),
            rule("GPT", ParticipantType.SERVICE),
            rule("^Claude$", ParticipantType.SERVICE),
            rule("Embedding", ParticipantType.SERVICE),
            rule("Inference", ParticipantType.SERVICE),
            rule("Pipeline$", ParticipantType.SERVICE),
            rule("Registry", ParticipantType.SERVICE),
            rule("Engine$", ParticipantType.SERVICE),
            rule("Daemon", ParticipantType.SERVICE),
            // external patterns
            rule("External", ParticipantType.EXTERNAL),
            rule("Ext$", ParticipantType.EXTERNAL),
            rule("ThirdParty", ParticipantType.EXTERNAL),
            rule("3P$", ParticipantType.EXTERNAL),
            rule("Vendor", ParticipantType.EXTERNAL),
            rule("Callback", ParticipantType.EXTERNAL),
            rule("^AWS$", ParticipantType.EXTERNAL),
            rule("^GCP$", ParticipantType.EXTERNAL),
            rule("Azure", ParticipantType.EXTERNAL)
    );

    private ParticipantInference(){}

    public static ParticipantType infer(String name){
        if(name == null || name.isEmpty()){
            return ParticipantType.DEFAULT;
        }
        for(Rule rule : RULES){
            if(rule.matches(name)){
                return rule.getType();
            }
        }
        return ParticipantType.DEFAULT;
    }

    public static List<Rule> getRules(){return RULES;}

    public static int ruleCount(){return RULES.size();}
}
