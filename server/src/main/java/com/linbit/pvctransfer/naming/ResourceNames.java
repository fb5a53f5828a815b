package com.linbit.pvctransfer.naming;

import com.linbit.pvctransfer.pvc.Pvc;
import com.linbit.pvctransfer.pvc.PvcList;
import com.linbit.pvctransfer.utils.ByteUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives the names of all objects owned by one transfer from its volume set.
 *
 * Every name has the form {@code <component>-<suffix>}. The suffix only depends on the
 * multiset of namespace/name pairs of the volume set, so reconciling the same set again
 * addresses the same objects. Names are cut from the right to the name limit without
 * re-hashing. Two sets may collide only if their component names are long enough for the
 * suffix to be cut off entirely.
 */
public class ResourceNames
{
    public static final int SUFFIX_LENGTH = 10;
    public static final int DEFAULT_NAME_LIMIT = 62;

    public static final String SERVER_STUNNEL_CONFIG = "server-stunnel-config";
    public static final String CLIENT_STUNNEL_CONFIG = "client-stunnel-config";
    public static final String STUNNEL_CREDENTIALS = "stunnel-credentials";
    public static final String RSYNC_CONFIG = "rsync-config";
    public static final String RSYNC_SECRET = "rsync-secret";
    public static final String RSYNC_SERVER = "rsync-server";
    public static final String RSYNC_PASSWORD = "rsync-password";
    public static final String RSYNC_CLIENT = "rsync-client";
    public static final String RSYNC_SERVICE_ACCOUNT = "rsync-sa";
    public static final String RSYNC_ROLE = "rsync-role";
    public static final String RSYNC_ROLE_BINDING = "rsync-rolebinding";
    public static final String RSYNC_ENDPOINT = "rsync-endpoint";

    private ResourceNames()
    {
    }

    /**
     * @return the first {@value #SUFFIX_LENGTH} hex characters of the MD5 digest over the sorted
     *     {@code namespace/name} pairs of the volume set, joined with {@code ,}
     */
    public static String identitySuffix(PvcList pvcList)
    {
        List<String> keys = new ArrayList<>();
        for (Pvc pvc : pvcList.getPvcs())
        {
            keys.add(pvc.getNamespace() + "/" + pvc.getName());
        }
        return hashOf(keys).substring(0, SUFFIX_LENGTH);
    }

    /**
     * @return the full length hash of the namespace/name pairs, per namespace of the volume set
     */
    public static Map<String, String> namespaceHashes(PvcList pvcList)
    {
        Map<String, String> ret = new TreeMap<>();
        for (String namespace : pvcList.getNamespaces())
        {
            List<String> keys = new ArrayList<>();
            for (Pvc pvc : pvcList.inNamespace(namespace).getPvcs())
            {
                keys.add(namespace + "/" + pvc.getName());
            }
            ret.put(namespace, hashOf(keys));
        }
        return ret;
    }

    private static String hashOf(List<String> keys)
    {
        List<String> sortedKeys = new ArrayList<>(keys);
        Collections.sort(sortedKeys);
        return ByteUtils.md5Hex(String.join(",", sortedKeys));
    }

    public static String build(String component, String suffix)
    {
        return build(component, suffix, DEFAULT_NAME_LIMIT);
    }

    public static String build(String component, String suffix, int limit)
    {
        String name = component + "-" + suffix;
        return name.length() > limit ? name.substring(0, limit) : name;
    }
}
